package com.chatrelay.model;

import java.util.Arrays;
import java.util.Optional;

/** Event tags a connection can produce. */
public enum InboundEvent {
    CONNECT("connect", false),
    JOIN_ROOM("join_room", true),
    LEAVE_ROOM("leave_room", true),
    SEND_MESSAGE("send_message", true),
    TYPING("typing", true),
    DISCONNECT("disconnect", false);

    private final String tag;
    private final boolean clientSent;

    InboundEvent(String tag, boolean clientSent) {
        this.tag = tag;
        this.clientSent = clientSent;
    }

    public String tag() {
        return tag;
    }

    /** {@code false} for lifecycle events that only the transport may raise. */
    public boolean isClientSent() {
        return clientSent;
    }

    public static Optional<InboundEvent> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(e -> e.tag.equals(tag))
                .findFirst();
    }
}
