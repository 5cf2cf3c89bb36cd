package com.chatrelay.service;

import com.chatrelay.config.ChatProperties;
import com.chatrelay.model.ChatDTOs;
import com.chatrelay.model.ChatMessage;
import com.chatrelay.model.ChatOutcome;
import com.chatrelay.model.OutboundEvent;
import com.chatrelay.model.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Chat messages and typing indicators. A message is stored before anyone sees it: if the store
 * refuses it, nothing is broadcast. Stores run under the room's message lock only; the ordering
 * lock is held just for the broadcast hand-off.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageRelay {

    static final String SEND_FAILED = "Failed to send message";
    static final String NOT_IN_ROOM = "Join a room before sending messages";

    private final SessionRegistry sessionRegistry;
    private final RoomDirectory roomDirectory;
    private final EventBroadcaster broadcaster;
    private final MessageStore messageStore;
    private final ChatProperties properties;
    private final Clock clock;

    // roomId → messages broadcast
    private final Map<String, AtomicLong> relayedCounts = new ConcurrentHashMap<>();

    public ChatOutcome<ChatMessage> sendMessage(String connectionId, String roomId, String text) {
        if (isBlank(roomId) || isBlank(text)) {
            return rejectMessage(connectionId, "roomId and text are required");
        }
        if (text.length() > ChatMessage.MAX_TEXT_LENGTH) {
            return rejectMessage(connectionId, "Message exceeds " + ChatMessage.MAX_TEXT_LENGTH + " characters");
        }

        return roomDirectory.appending(roomId, () -> {
            Optional<Session> session = sessionRegistry.get(connectionId);
            if (session.isEmpty()) {
                log.debug("send_message from connection {} without a session", connectionId);
                broadcaster.sendTo(connectionId, OutboundEvent.ERROR, error(NOT_IN_ROOM));
                return ChatOutcome.unknownSession(connectionId);
            }

            ChatMessage message = ChatMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .roomId(roomId)
                    .username(session.get().getUsername())
                    .text(text)
                    .timestamp(clock.instant())
                    .build();

            // store outside the ordering lock: membership changes go ahead while this blocks
            if (!persist(message)) {
                log.error("Message id={} in room '{}' not stored, broadcast skipped", message.getId(), roomId);
                broadcaster.sendTo(connectionId, OutboundEvent.ERROR, error(SEND_FAILED));
                return ChatOutcome.persistenceFailure("Message " + message.getId() + " was not stored");
            }

            roomDirectory.sequenced(roomId, () -> {
                relayed(roomId).incrementAndGet();
                return broadcaster.broadcast(roomId, OutboundEvent.NEW_MESSAGE, ChatDTOs.MessagePayload.from(message));
            });
            log.debug("Message from '{}' in room '{}' relayed (id={})", message.getUsername(), roomId, message.getId());
            return ChatOutcome.applied(message);
        });
    }

    /**
     * Tells everyone else in the room that the sender started or stopped typing. Failures are
     * only logged.
     */
    public ChatOutcome<ChatDTOs.TypingPayload> typingIndicator(String connectionId, String roomId, boolean isTyping) {
        if (isBlank(roomId)) {
            log.debug("typing from connection {} without roomId", connectionId);
            return ChatOutcome.validationError("roomId is required");
        }
        try {
            return roomDirectory.sequenced(roomId, () -> {
                Optional<Session> session = sessionRegistry.get(connectionId);
                if (session.isEmpty()) {
                    return ChatOutcome.unknownSession(connectionId);
                }
                ChatDTOs.TypingPayload payload = ChatDTOs.TypingPayload.builder()
                        .username(session.get().getUsername())
                        .isTyping(isTyping)
                        .build();
                broadcaster.broadcast(roomId, OutboundEvent.USER_TYPING, payload, connectionId);
                return ChatOutcome.applied(payload);
            });
        } catch (RuntimeException e) {
            log.error("Error handling typing for connection {} in room '{}'", connectionId, roomId, e);
            return ChatOutcome.internalError(e.getMessage());
        }
    }

    /**
     * Recent history for a joining connection. A failing store yields an empty history rather
     * than a failed join.
     */
    public List<ChatDTOs.MessagePayload> recentHistory(String roomId) {
        try {
            return messageStore.fetchRecentMessages(roomId, properties.getHistoryLimit()).stream()
                    .map(ChatDTOs.MessagePayload::from)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("Failed to load history for room '{}'", roomId, e);
            return List.of();
        }
    }

    /**
     * Number of messages broadcast in {@code roomId} so far. Read it before loading history and
     * compare under the ordering lock to learn whether a message went out in between.
     */
    public long relayedCount(String roomId) {
        return relayed(roomId).get();
    }

    private AtomicLong relayed(String roomId) {
        return relayedCounts.computeIfAbsent(roomId, id -> new AtomicLong());
    }

    private boolean persist(ChatMessage message) {
        try {
            return messageStore.insertMessage(message);
        } catch (RuntimeException e) {
            log.error("Message store threw for message id={} in room={}", message.getId(), message.getRoomId(), e);
            return false;
        }
    }

    private <T> ChatOutcome<T> rejectMessage(String connectionId, String reason) {
        broadcaster.sendTo(connectionId, OutboundEvent.ERROR, error(reason));
        return ChatOutcome.validationError(reason);
    }

    static ChatDTOs.ErrorPayload error(String message) {
        return ChatDTOs.ErrorPayload.builder().message(message).build();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
