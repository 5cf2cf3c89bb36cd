package com.chatrelay.service;

import com.chatrelay.model.OutboundEvent;
import com.chatrelay.model.RoomMember;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans events out to the connections listed in a room. A recipient that cannot be reached is
 * logged and skipped; it never fails the delivery to others or the operation that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventBroadcaster {

    private final RoomDirectory roomDirectory;
    private final EventSink eventSink;

    /**
     * Delivers {@code payload} to every member connection of {@code roomId}.
     *
     * @param excludeConnectionId connection to skip, or {@code null} to include everybody
     */
    public BroadcastReport broadcast(String roomId, OutboundEvent event, Object payload,
                                     @Nullable String excludeConnectionId) {
        Set<String> recipients = new LinkedHashSet<>();
        for (RoomMember member : roomDirectory.listMembers(roomId)) {
            recipients.add(member.getConnectionId());
        }
        if (excludeConnectionId != null) {
            recipients.remove(excludeConnectionId);
        }

        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (String connectionId : recipients) {
            if (deliver(connectionId, event, payload)) {
                delivered++;
            } else {
                failed.add(connectionId);
            }
        }
        log.debug("Broadcast {} to room '{}': delivered={} failed={}", event.tag(), roomId, delivered, failed.size());
        return new BroadcastReport(delivered, List.copyOf(failed));
    }

    public BroadcastReport broadcast(String roomId, OutboundEvent event, Object payload) {
        return broadcast(roomId, event, payload, null);
    }

    /** Direct delivery to one connection, same failure policy as a broadcast. */
    public boolean sendTo(String connectionId, OutboundEvent event, Object payload) {
        return deliver(connectionId, event, payload);
    }

    private boolean deliver(String connectionId, OutboundEvent event, Object payload) {
        try {
            eventSink.send(connectionId, event, payload);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} to connection {}: {}", event.tag(), connectionId, e.getMessage());
            return false;
        }
    }
}
