package com.chatrelay.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of a room's presence list. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomMember {
    private String username;
    private String connectionId;
}
