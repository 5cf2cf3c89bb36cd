package com.chatrelay.controller;

import com.chatrelay.model.ChatDTOs;
import com.chatrelay.model.ChatOutcome;
import com.chatrelay.model.OutboundEvent;
import com.chatrelay.service.ChatEventDispatcher;
import com.chatrelay.service.EventBroadcaster;
import com.chatrelay.service.PresenceCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;

import java.util.Map;

/**
 * Handles all inbound WebSocket messages from clients.
 *
 * Flow:
 *  Client SUBSCRIBE /app/connected → connected ack, sent once as the subscription reply
 *  Client → /app/join_room      → join a room
 *  Client → /app/leave_room     → leave a room
 *  Client → /app/send_message   → persist and broadcast a message
 *  Client → /app/typing         → broadcast typing indicator
 *
 * Replies go to /user/queue/{event} of the sending session or of every room member.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatController {

    static final String MALFORMED_FRAME = "Malformed payload";

    private final ChatEventDispatcher dispatcher;
    private final PresenceCoordinator presence;
    private final EventBroadcaster broadcaster;

    @SubscribeMapping("/connected")
    public ChatDTOs.ConnectedPayload onConnectedSubscription(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        ChatOutcome<ChatDTOs.ConnectedPayload> outcome = presence.connect(sessionId);
        log.debug("Sending {} to session {}", OutboundEvent.CONNECTED.tag(), sessionId);
        return outcome.getValue().orElseThrow();
    }

    @MessageMapping("/{event}")
    public void onEvent(@DestinationVariable("event") String event,
                        @Payload(required = false) Map<String, Object> body,
                        SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        ChatOutcome<?> outcome = dispatcher.dispatchClientEvent(event, sessionId, body);
        log.debug("Event '{}' from session {} -> {}", event, sessionId, outcome.getStatus());
    }

    /** Frame bodies that are not a JSON object never reach the dispatcher. */
    @MessageExceptionHandler(MessageConversionException.class)
    public void onUnreadableFrame(MessageConversionException e, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        log.warn("Unreadable frame from session {}: {}", sessionId, e.getMessage());
        broadcaster.sendTo(sessionId, OutboundEvent.ERROR, ChatDTOs.ErrorPayload.builder()
                .message(MALFORMED_FRAME)
                .build());
    }
}
