package com.chatrelay.service;

import com.chatrelay.model.ChatMessage;
import com.chatrelay.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link MessageStore} backed by Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService implements MessageStore {

    private final MessageRepository messageRepository;

    /**
     * Saves synchronously; the repository commits before this returns, so a broadcast that
     * follows can rely on the message being in history.
     */
    @Override
    public boolean insertMessage(ChatMessage message) {
        try {
            ChatMessage saved = messageRepository.save(message);
            log.debug("Persisted message id={} in room={}", saved.getId(), saved.getRoomId());
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to persist message id={} in room={}", message.getId(), message.getRoomId(), e);
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> fetchRecentMessages(String roomId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ChatMessage> newestFirst = messageRepository.findNewestByRoomId(roomId, PageRequest.of(0, limit));
        List<ChatMessage> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }
}
