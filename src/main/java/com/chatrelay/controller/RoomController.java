package com.chatrelay.controller;

import com.chatrelay.config.ChatProperties;
import com.chatrelay.model.ChatDTOs;
import com.chatrelay.service.MessageStore;
import com.chatrelay.service.RoomDirectory;
import com.chatrelay.service.RoomService;
import com.chatrelay.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;
    private final MessageStore messageStore;
    private final RoomDirectory roomDirectory;
    private final SessionRegistry sessionRegistry;
    private final ChatProperties properties;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Chat Relay API");
    }

    /** Get all rooms with live online counts */
    @GetMapping("/rooms")
    public ResponseEntity<List<ChatDTOs.RoomPayload>> getRooms() {
        return ResponseEntity.ok(roomService.getAllRooms());
    }

    /** Create a new room */
    @PostMapping("/rooms")
    public ResponseEntity<?> createRoom(@RequestBody ChatDTOs.CreateRoomRequest body) {
        if (body.getName() == null || body.getName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Name is required"));
        }
        String createdBy = body.getCreatedBy() == null || body.getCreatedBy().isBlank()
                ? "anonymous"
                : body.getCreatedBy();
        return ResponseEntity.ok(roomService.createRoom(body.getName(), createdBy));
    }

    /** Last N messages of a room, oldest first */
    @GetMapping("/rooms/{roomId}/messages")
    public ResponseEntity<List<ChatDTOs.MessagePayload>> getRoomMessages(@PathVariable("roomId") String roomId,
                                                                         @RequestParam(value = "limit", defaultValue = "50") int limit) {
        int pageSize = Math.max(1, Math.min(limit, properties.getMaxPageSize()));
        return ResponseEntity.ok(messageStore.fetchRecentMessages(roomId, pageSize).stream()
                .map(ChatDTOs.MessagePayload::from)
                .collect(Collectors.toList()));
    }

    /** Get users present in a room */
    @GetMapping("/rooms/{roomId}/users")
    public ResponseEntity<Map<String, Object>> getRoomUsers(@PathVariable("roomId") String roomId) {
        var users = roomDirectory.listMembers(roomId);
        return ResponseEntity.ok(Map.of(
                "roomId", roomId,
                "users", users,
                "count", users.size()
        ));
    }

    /** Get stats */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "connections", sessionRegistry.getConnectionCount(),
                "sessions", sessionRegistry.getSessionCount(),
                "rooms", roomDirectory.getRoomIds().size()
        ));
    }
}
