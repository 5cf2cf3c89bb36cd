package com.chatrelay.model;

/** Event tags delivered to connections. Each maps to its own user queue. */
public enum OutboundEvent {
    CONNECTED("connected"),
    ROOM_JOINED("room_joined"),
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    NEW_MESSAGE("new_message"),
    USER_TYPING("user_typing"),
    ERROR("error");

    private final String tag;

    OutboundEvent(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Destination relative to the user prefix, e.g. {@code /queue/new_message}. */
    public String destination() {
        return "/queue/" + tag;
    }
}
