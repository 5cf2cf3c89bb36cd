package com.chatrelay.service;

import com.chatrelay.model.RoomMember;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Room → members, in join order. Rooms appear on first use and are never removed.
 *
 * <p>Each room carries three locks. The read/write lock guards the member map and is only held for
 * in-memory work. The ordering lock is taken through {@link #sequenced(String, Supplier)} and
 * serializes membership changes together with their fanout hand-off; nothing blocking runs under
 * it. The message lock is taken through {@link #appending(String, Supplier)} and serializes
 * message writes. When both are needed the message lock is acquired first.
 */
@Slf4j
@Service
public class RoomDirectory {

    // roomId → room
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    /**
     * Adds {@code username} unless the room already lists it.
     *
     * @return {@code true} if the member set changed
     */
    public boolean addMember(String roomId, String username, String connectionId) {
        Room room = room(roomId);
        room.state.writeLock().lock();
        try {
            return room.members.putIfAbsent(username, connectionId) == null;
        } finally {
            room.state.writeLock().unlock();
        }
    }

    /** @return {@code true} if an entry was removed */
    public boolean removeMember(String roomId, String username) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return false;
        }
        room.state.writeLock().lock();
        try {
            return room.members.remove(username) != null;
        } finally {
            room.state.writeLock().unlock();
        }
    }

    /** Snapshot of the room's members; empty for a room nobody has joined. */
    public List<RoomMember> listMembers(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return List.of();
        }
        room.state.readLock().lock();
        try {
            return room.members.entrySet().stream()
                    .map(e -> new RoomMember(e.getKey(), e.getValue()))
                    .collect(Collectors.toUnmodifiableList());
        } finally {
            room.state.readLock().unlock();
        }
    }

    public Set<String> getRoomIds() {
        return Set.copyOf(rooms.keySet());
    }

    /**
     * Runs {@code action} while holding the room's ordering lock. Operations on one room observe
     * and publish in the order they acquire it; other rooms are unaffected.
     */
    public <T> T sequenced(String roomId, Supplier<T> action) {
        Lock order = room(roomId).order;
        order.lock();
        try {
            return action.get();
        } finally {
            order.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the room's message lock. Messages of one room are stored
     * and handed to {@link #sequenced(String, Supplier)} one at a time, so their broadcast order
     * is their storage order. Joins, leaves and disconnects never wait for this lock.
     */
    public <T> T appending(String roomId, Supplier<T> action) {
        Lock append = room(roomId).append;
        append.lock();
        try {
            return action.get();
        } finally {
            append.unlock();
        }
    }

    private Room room(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            log.debug("Room created: {}", id);
            return new Room();
        });
    }

    private static final class Room {
        final Lock order = new ReentrantLock(true);
        final Lock append = new ReentrantLock(true);
        final ReadWriteLock state = new ReentrantReadWriteLock();
        // username → connectionId
        final Map<String, String> members = new LinkedHashMap<>();
    }
}
