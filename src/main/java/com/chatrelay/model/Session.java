package com.chatrelay.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Binds one live connection to a username and, optionally, the room it currently sits in.
 * Immutable; {@link com.chatrelay.service.SessionRegistry} swaps whole instances.
 */
@Value
@Builder
public class Session {
    String connectionId;
    String username;

    /** {@code null} once the connection has left its room. */
    @With
    String roomId;

    public boolean isInRoom(String candidate) {
        return roomId != null && roomId.equals(candidate);
    }
}
