package com.chatrelay.service;

import com.chatrelay.model.OutboundEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Sends events to a single STOMP session. Clients subscribe to {@code /user/queue/{event}}.
 */
@Component
@RequiredArgsConstructor
public class StompEventSink implements EventSink {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void send(String connectionId, OutboundEvent event, Object payload) {
        messagingTemplate.convertAndSendToUser(connectionId, event.destination(), payload,
                buildNativeHeaders(connectionId));
    }

    /** Build headers that correctly target a session ID when using convertAndSendToUser */
    private MessageHeaders buildNativeHeaders(String sessionId) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}
