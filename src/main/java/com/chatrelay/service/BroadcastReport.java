package com.chatrelay.service;

import lombok.Value;

import java.util.List;

/** Per-recipient tally of one fanout. */
@Value
public class BroadcastReport {
    int delivered;
    List<String> failedConnectionIds;

    public boolean isComplete() {
        return failedConnectionIds.isEmpty();
    }
}
