package com.chatrelay.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocketMessageBroker
@EnableConfigurationProperties(ChatProperties.class)
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final ChatProperties properties;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // Enable a simple in-memory message broker
        // Queues: /user/queue/{event} for per-connection delivery of every outbound event
        config.enableSimpleBroker("/topic", "/queue");

        // Prefix for messages FROM client TO server: /app/{event}
        config.setApplicationDestinationPrefixes("/app");

        // Prefix for user-specific messages
        config.setUserDestinationPrefix("/user");

        // Events for one session leave in the order the room published them
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = properties.getAllowedOrigins().toArray(new String[0]);

        // Frames from one session are handled one at a time, in arrival order
        registry.setPreserveReceiveOrder(true);

        // STOMP endpoint, clients connect here
        registry.addEndpoint(properties.getEndpoint())
                .setAllowedOriginPatterns(origins)
                .withSockJS(); // SockJS fallback for non-WebSocket browsers
    }
}
