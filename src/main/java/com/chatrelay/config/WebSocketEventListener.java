package com.chatrelay.config;

import com.chatrelay.model.InboundEvent;
import com.chatrelay.service.ChatEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Feeds transport lifecycle into the dispatcher as {@code connect} and {@code disconnect}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketEventListener {

    private final ChatEventDispatcher dispatcher;

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        String sessionId = SimpMessageHeaderAccessor.wrap(event.getMessage()).getSessionId();
        log.debug("New WebSocket connection: sessionId={}", sessionId);
        dispatcher.dispatch(InboundEvent.CONNECT, sessionId, null);
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        log.debug("WebSocket closed: sessionId={} status={}", sessionId, event.getCloseStatus());
        dispatcher.dispatch(InboundEvent.DISCONNECT, sessionId, null);
    }
}
