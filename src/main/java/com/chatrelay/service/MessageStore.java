package com.chatrelay.service;

import com.chatrelay.model.ChatMessage;

import java.util.List;

/**
 * Durable message log consumed by {@link MessageRelay}.
 */
public interface MessageStore {

    /**
     * Persists one message.
     *
     * @return {@code true} once the message is durable and visible to
     *         {@link #fetchRecentMessages(String, int)}
     */
    boolean insertMessage(ChatMessage message);

    /**
     * The newest {@code limit} messages of a room, ordered oldest to newest.
     */
    List<ChatMessage> fetchRecentMessages(String roomId, int limit);
}
