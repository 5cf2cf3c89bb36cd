package com.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * All DTOs (Data Transfer Objects) used in WebSocket and REST communication.
 */
public class ChatDTOs {

    // ── Inbound (Client → Server) ─────────────────────────────────────────────

    /** Sent when a user joins a room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JoinRequest {
        @NotBlank @Size(max = 64)
        private String username;

        @NotBlank @JsonAlias("room_id")
        private String roomId;
    }

    /** Sent when a user leaves a room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LeaveRequest {
        @NotBlank @JsonAlias("room_id")
        private String roomId;
    }

    /** Sent when a user sends a chat message */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SendMessageRequest {
        @NotBlank @JsonAlias("room_id")
        private String roomId;

        @NotBlank @Size(max = ChatMessage.MAX_TEXT_LENGTH) @JsonAlias("message")
        private String text;
    }

    /** Sent when typing status changes */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TypingRequest {
        @NotBlank @JsonAlias("room_id")
        private String roomId;

        @NotNull @JsonAlias("is_typing")
        private Boolean isTyping;
    }

    // ── Outbound (Server → Client) ────────────────────────────────────────────

    /** Acknowledges a new connection */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ConnectedPayload {
        private String message;
    }

    /** Sent only to the joining connection */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomJoinedPayload {
        private String roomId;
        private List<MessagePayload> messages;
        private List<RoomMember> users;
    }

    /** user_joined / user_left: who changed, plus the presence list after the change */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class PresencePayload {
        private String username;
        private List<RoomMember> users;
    }

    /** Full message payload sent to room members */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MessagePayload {
        private String id;
        private String roomId;
        private String username;
        private String message;
        private Instant timestamp;

        public static MessagePayload from(ChatMessage message) {
            return MessagePayload.builder()
                    .id(message.getId())
                    .roomId(message.getRoomId())
                    .username(message.getUsername())
                    .message(message.getText())
                    .timestamp(message.getTimestamp())
                    .build();
        }
    }

    /** Ephemeral typing status, never persisted */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class TypingPayload {
        private String username;
        private Boolean isTyping;
    }

    /** Error payload */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ErrorPayload {
        private String message;
    }

    /** Room info payload */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomPayload {
        private String id;
        private String name;
        private String createdBy;
        private Instant createdAt;
        private int onlineCount;
    }

    /** Body of POST /api/rooms */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateRoomRequest {
        @JsonAlias("room_name")
        private String name;

        @JsonAlias("created_by")
        private String createdBy;
    }
}
