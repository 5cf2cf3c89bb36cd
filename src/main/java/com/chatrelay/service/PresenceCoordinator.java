package com.chatrelay.service;

import com.chatrelay.model.ChatDTOs;
import com.chatrelay.model.ChatOutcome;
import com.chatrelay.model.OutboundEvent;
import com.chatrelay.model.RoomMember;
import com.chatrelay.model.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Join, leave and disconnect. Keeps {@link SessionRegistry} and {@link RoomDirectory} in step:
 * every change to a room happens under that room's ordering lock together with the session
 * update and the resulting fanout. No store access happens under that lock.
 *
 * <p>Per connection: {@code Connected → JoinedRoom(roomId) → Disconnected}. A join always
 * overwrites the session's room pointer and does not leave the previous room.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceCoordinator {

    static final String JOIN_FAILED = "Failed to join room";
    static final int HISTORY_ATTEMPTS = 3;

    private final SessionRegistry sessionRegistry;
    private final RoomDirectory roomDirectory;
    private final EventBroadcaster broadcaster;
    private final MessageRelay messageRelay;

    /**
     * Opens the connection slot. The returned payload is the {@code connected} ack, which the
     * client receives by subscribing to {@code /app/connected}.
     */
    public ChatOutcome<ChatDTOs.ConnectedPayload> connect(String connectionId) {
        boolean opened = sessionRegistry.connect(connectionId);
        ChatDTOs.ConnectedPayload ack = ChatDTOs.ConnectedPayload.builder()
                .message("Connected to server")
                .build();
        if (opened) {
            log.info("Client {} connected", connectionId);
        }
        return opened ? ChatOutcome.applied(ack) : ChatOutcome.unchanged(ack);
    }

    /**
     * Registers the session and adds it to the room. History is loaded before the room lock is
     * taken; if a message went out in the meantime it is loaded again, at most
     * {@value #HISTORY_ATTEMPTS} times.
     */
    public ChatOutcome<ChatDTOs.RoomJoinedPayload> join(String connectionId, String username, String roomId) {
        if (MessageRelay.isBlank(username) || MessageRelay.isBlank(roomId)) {
            broadcaster.sendTo(connectionId, OutboundEvent.ERROR, MessageRelay.error(JOIN_FAILED));
            return ChatOutcome.validationError("username and roomId are required");
        }

        for (int attempt = 1; ; attempt++) {
            long relayedBefore = messageRelay.relayedCount(roomId);
            List<ChatDTOs.MessagePayload> history = messageRelay.recentHistory(roomId);
            boolean lastAttempt = attempt >= HISTORY_ATTEMPTS;
            ChatOutcome<ChatDTOs.RoomJoinedPayload> outcome = roomDirectory.sequenced(roomId, () -> {
                if (!lastAttempt && messageRelay.relayedCount(roomId) != relayedBefore) {
                    return null;
                }
                return joinLocked(connectionId, username, roomId, history);
            });
            if (outcome != null) {
                return outcome;
            }
            log.debug("History for room '{}' changed while loading, retrying join of '{}'", roomId, username);
        }
    }

    private ChatOutcome<ChatDTOs.RoomJoinedPayload> joinLocked(String connectionId, String username, String roomId,
                                                               List<ChatDTOs.MessagePayload> history) {
        if (sessionRegistry.register(connectionId, username, roomId).isEmpty()) {
            return ChatOutcome.unknownSession(connectionId);
        }
        boolean added = roomDirectory.addMember(roomId, username, connectionId);
        List<RoomMember> users = roomDirectory.listMembers(roomId);

        ChatDTOs.RoomJoinedPayload joined = ChatDTOs.RoomJoinedPayload.builder()
                .roomId(roomId)
                .messages(history)
                .users(users)
                .build();
        broadcaster.sendTo(connectionId, OutboundEvent.ROOM_JOINED, joined);

        if (!added) {
            log.debug("User '{}' already present in room '{}'", username, roomId);
            return ChatOutcome.unchanged(joined);
        }
        broadcaster.broadcast(roomId, OutboundEvent.USER_JOINED, presence(username, users));
        log.info("User '{}' joined room '{}' ({} present)", username, roomId, users.size());
        return ChatOutcome.applied(joined);
    }

    public ChatOutcome<ChatDTOs.PresencePayload> leave(String connectionId, String roomId) {
        if (MessageRelay.isBlank(roomId)) {
            broadcaster.sendTo(connectionId, OutboundEvent.ERROR, MessageRelay.error("roomId is required"));
            return ChatOutcome.validationError("roomId is required");
        }
        try {
            return roomDirectory.sequenced(roomId, () -> {
                Optional<Session> session = sessionRegistry.get(connectionId);
                if (session.isEmpty()) {
                    log.debug("leave_room from connection {} without a session", connectionId);
                    return ChatOutcome.unknownSession(connectionId);
                }
                String username = session.get().getUsername();
                ChatDTOs.PresencePayload left = removeAndNotify(roomId, username);
                sessionRegistry.clearRoom(connectionId, roomId);
                log.info("User '{}' left room '{}'", username, roomId);
                return ChatOutcome.applied(left);
            });
        } catch (RuntimeException e) {
            log.error("Error leaving room '{}' for connection {}", roomId, connectionId, e);
            return ChatOutcome.internalError(e.getMessage());
        }
    }

    /**
     * Releases everything the connection held. The session is gone before this method takes any
     * room lock, so operations still in flight for the connection cannot register it again.
     */
    public ChatOutcome<Session> disconnect(String connectionId) {
        Optional<Session> removed = sessionRegistry.remove(connectionId);
        if (removed.isEmpty()) {
            log.info("Client {} disconnected", connectionId);
            return ChatOutcome.unknownSession(connectionId);
        }
        Session session = removed.get();
        String roomId = session.getRoomId();
        if (roomId != null) {
            try {
                roomDirectory.sequenced(roomId, () -> removeAndNotify(roomId, session.getUsername()));
            } catch (RuntimeException e) {
                log.error("Error removing '{}' from room '{}' on disconnect", session.getUsername(), roomId, e);
            }
        }
        log.info("Client {} ('{}') disconnected", connectionId, session.getUsername());
        return ChatOutcome.applied(session);
    }

    private ChatDTOs.PresencePayload removeAndNotify(String roomId, String username) {
        roomDirectory.removeMember(roomId, username);
        ChatDTOs.PresencePayload left = presence(username, roomDirectory.listMembers(roomId));
        broadcaster.broadcast(roomId, OutboundEvent.USER_LEFT, left);
        return left;
    }

    private static ChatDTOs.PresencePayload presence(String username, List<RoomMember> users) {
        return ChatDTOs.PresencePayload.builder()
                .username(username)
                .users(users)
                .build();
    }
}
