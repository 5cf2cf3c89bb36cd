package com.chatrelay.service;

import com.chatrelay.model.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory store of live connections and their sessions.
 * Key: connection (WebSocket session) ID → slot holding the Session, if any.
 *
 * <p>A slot exists from connect until disconnect. Sessions can only be registered into an open
 * slot, so work still in flight for a closed connection cannot bring its session back.
 */
@Slf4j
@Service
public class SessionRegistry {

    // connectionId → slot
    private final Map<String, Slot> connections = new ConcurrentHashMap<>();

    /** Opens an empty slot. Returns {@code false} if the connection was already known. */
    public boolean connect(String connectionId) {
        boolean opened = connections.putIfAbsent(connectionId, Slot.EMPTY) == null;
        if (opened) {
            log.debug("Connection opened: {}", connectionId);
        }
        return opened;
    }

    /**
     * Creates or overwrites the session of an open connection.
     *
     * @return the new session, or empty if the connection is not open
     */
    public Optional<Session> register(String connectionId, String username, String roomId) {
        Session session = Session.builder()
                .connectionId(connectionId)
                .username(username)
                .roomId(roomId)
                .build();
        Slot slot = connections.computeIfPresent(connectionId, (id, current) -> new Slot(session));
        if (slot == null) {
            log.debug("Register ignored, connection {} is closed", connectionId);
            return Optional.empty();
        }
        log.debug("Session registered: {} in room {} (connection={})", username, roomId, connectionId);
        return Optional.of(session);
    }

    public Optional<Session> get(String connectionId) {
        Slot slot = connections.get(connectionId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.session);
    }

    /** Destroys the slot and returns the session it held. */
    public Optional<Session> remove(String connectionId) {
        Slot removed = connections.remove(connectionId);
        if (removed == null) {
            return Optional.empty();
        }
        if (removed.session != null) {
            log.debug("Session removed: {} (connection={})", removed.session.getUsername(), connectionId);
        }
        return Optional.ofNullable(removed.session);
    }

    /** Clears the room pointer, but only while it still names {@code roomId}. */
    public Optional<Session> clearRoom(String connectionId, String roomId) {
        Slot slot = connections.computeIfPresent(connectionId, (id, current) ->
                current.session != null && current.session.isInRoom(roomId)
                        ? new Slot(current.session.withRoomId(null))
                        : current);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.session);
    }

    public boolean isConnected(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public int getSessionCount() {
        return (int) connections.values().stream()
                .filter(slot -> slot.session != null)
                .count();
    }

    /** Usernames of all sessions whose room pointer names {@code roomId}. */
    public Set<String> usernamesInRoom(String roomId) {
        return connections.values().stream()
                .map(slot -> slot.session)
                .filter(Objects::nonNull)
                .filter(s -> s.isInRoom(roomId))
                .map(Session::getUsername)
                .collect(Collectors.toSet());
    }

    private static final class Slot {
        static final Slot EMPTY = new Slot(null);

        final Session session;

        Slot(Session session) {
            this.session = session;
        }
    }
}
