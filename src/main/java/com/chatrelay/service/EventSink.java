package com.chatrelay.service;

import com.chatrelay.model.OutboundEvent;

/**
 * Transport output: delivers one event to one connection. Implementations throw an unchecked
 * exception when delivery to that connection fails.
 */
public interface EventSink {

    void send(String connectionId, OutboundEvent event, Object payload);
}
