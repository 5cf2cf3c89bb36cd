package com.chatrelay.service;

import com.chatrelay.model.ChatDTOs;
import com.chatrelay.model.ChatRoom;
import com.chatrelay.repository.ChatRoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Room catalogue for the REST surface. Presence does not depend on it: any room id can be
 * joined whether or not it is listed here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final ChatRoomRepository chatRoomRepository;
    private final RoomDirectory roomDirectory;

    public List<ChatDTOs.RoomPayload> getAllRooms() {
        return chatRoomRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(this::toPayload)
                .collect(Collectors.toList());
    }

    public ChatDTOs.RoomPayload createRoom(String name, String createdBy) {
        ChatRoom room = ChatRoom.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .createdBy(createdBy)
                .build();
        ChatRoom saved = chatRoomRepository.save(room);
        log.info("Room '{}' created by {} (id={})", saved.getName(), createdBy, saved.getId());
        return toPayload(saved);
    }

    private ChatDTOs.RoomPayload toPayload(ChatRoom room) {
        return ChatDTOs.RoomPayload.builder()
                .id(room.getId())
                .name(room.getName())
                .createdBy(room.getCreatedBy())
                .createdAt(room.getCreatedAt())
                .onlineCount(roomDirectory.listMembers(room.getId()).size())
                .build();
    }
}
