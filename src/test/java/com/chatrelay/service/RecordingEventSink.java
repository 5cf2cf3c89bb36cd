package com.chatrelay.service;

import com.chatrelay.model.OutboundEvent;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Captures every delivery in order. Connections marked unreachable make {@link #send} throw.
 */
class RecordingEventSink implements EventSink {

    @Value
    static class Delivery {
        String connectionId;
        OutboundEvent event;
        Object payload;
    }

    private final List<Delivery> deliveries = new ArrayList<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();

    @Override
    public void send(String connectionId, OutboundEvent event, Object payload) {
        if (unreachable.contains(connectionId)) {
            throw new IllegalStateException("connection " + connectionId + " is gone");
        }
        synchronized (deliveries) {
            deliveries.add(new Delivery(connectionId, event, payload));
        }
    }

    void unreachable(String connectionId) {
        unreachable.add(connectionId);
    }

    List<Delivery> all() {
        synchronized (deliveries) {
            return List.copyOf(deliveries);
        }
    }

    List<Delivery> to(String connectionId) {
        return all().stream()
                .filter(d -> d.getConnectionId().equals(connectionId))
                .collect(Collectors.toList());
    }

    /** Payloads of one event type delivered to one connection, in delivery order. */
    <T> List<T> payloads(String connectionId, OutboundEvent event, Class<T> type) {
        return to(connectionId).stream()
                .filter(d -> d.getEvent() == event)
                .map(d -> type.cast(d.getPayload()))
                .collect(Collectors.toList());
    }

    List<Delivery> of(OutboundEvent event) {
        return all().stream()
                .filter(d -> d.getEvent() == event)
                .collect(Collectors.toList());
    }

    void clear() {
        synchronized (deliveries) {
            deliveries.clear();
        }
    }
}
