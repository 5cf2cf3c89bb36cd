package com.chatrelay.service;

import com.chatrelay.model.ChatDTOs;
import com.chatrelay.model.ChatOutcome;
import com.chatrelay.model.InboundEvent;
import com.chatrelay.model.OutboundEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dispatch table from inbound event tag to handler. Payloads are converted to their request
 * DTO and validated here; a bad payload is answered with an {@code error} event to the sender
 * and never reaches the coordinator.
 */
@Slf4j
@Service
public class ChatEventDispatcher {

    private final ObjectMapper mapper;
    private final Validator validator;
    private final EventBroadcaster broadcaster;
    private final Map<InboundEvent, Route<?>> routes = new EnumMap<>(InboundEvent.class);

    public ChatEventDispatcher(PresenceCoordinator presence,
                               MessageRelay relay,
                               EventBroadcaster broadcaster,
                               ObjectMapper mapper,
                               Validator validator) {
        this.mapper = mapper;
        this.validator = validator;
        this.broadcaster = broadcaster;

        lifecycle(InboundEvent.CONNECT, presence::connect);
        lifecycle(InboundEvent.DISCONNECT, presence::disconnect);
        route(InboundEvent.JOIN_ROOM, ChatDTOs.JoinRequest.class, true,
                (c, r) -> presence.join(c, r.getUsername(), r.getRoomId()));
        route(InboundEvent.LEAVE_ROOM, ChatDTOs.LeaveRequest.class, true,
                (c, r) -> presence.leave(c, r.getRoomId()));
        route(InboundEvent.SEND_MESSAGE, ChatDTOs.SendMessageRequest.class, true,
                (c, r) -> relay.sendMessage(c, r.getRoomId(), r.getText()));
        // typing never answers with an error
        route(InboundEvent.TYPING, ChatDTOs.TypingRequest.class, false,
                (c, r) -> relay.typingIndicator(c, r.getRoomId(), r.getIsTyping()));
    }

    /**
     * Runs the handler for {@code event}.
     *
     * @param body raw JSON object of the frame; ignored for connect and disconnect
     */
    public ChatOutcome<?> dispatch(InboundEvent event, String connectionId, @Nullable Map<String, Object> body) {
        Route<?> route = routes.get(event);
        if (route == null) {
            throw new IllegalStateException("No handler registered for " + event);
        }
        return route.handle(connectionId, body == null ? Map.of() : body);
    }

    /**
     * Entry point for frames sent by clients. Unknown tags and lifecycle events are rejected.
     */
    public ChatOutcome<?> dispatchClientEvent(String tag, String connectionId, @Nullable Map<String, Object> body) {
        InboundEvent event = InboundEvent.fromTag(tag)
                .filter(InboundEvent::isClientSent)
                .orElse(null);
        if (event == null) {
            log.warn("Unsupported event '{}' from connection {}", tag, connectionId);
            return reject(connectionId, "Unsupported event: " + tag, true);
        }
        return dispatch(event, connectionId, body);
    }

    private void lifecycle(InboundEvent event, Function<String, ChatOutcome<?>> handler) {
        routes.put(event, new Route<>(Void.class, false, (c, ignored) -> handler.apply(c)));
    }

    private <R> void route(InboundEvent event, Class<R> type, boolean reportErrors,
                           BiFunction<String, R, ChatOutcome<?>> handler) {
        routes.put(event, new Route<>(type, reportErrors, handler));
    }

    private ChatOutcome<?> reject(String connectionId, String reason, boolean report) {
        if (report) {
            broadcaster.sendTo(connectionId, OutboundEvent.ERROR, MessageRelay.error(reason));
        }
        return ChatOutcome.validationError(reason);
    }

    private final class Route<R> {
        private final Class<R> type;
        private final boolean reportErrors;
        private final BiFunction<String, R, ChatOutcome<?>> handler;

        Route(Class<R> type, boolean reportErrors, BiFunction<String, R, ChatOutcome<?>> handler) {
            this.type = type;
            this.reportErrors = reportErrors;
            this.handler = handler;
        }

        ChatOutcome<?> handle(String connectionId, Map<String, Object> body) {
            if (type == Void.class) {
                return handler.apply(connectionId, null);
            }

            R request;
            try {
                request = mapper.convertValue(body, type);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid payload for {} from connection {}: {}", type.getSimpleName(), connectionId, e.getMessage());
                return reject(connectionId, "Malformed payload", reportErrors);
            }

            Set<ConstraintViolation<R>> violations = validator.validate(request);
            if (!violations.isEmpty()) {
                String reason = violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining(", "));
                log.warn("Validation failed for {} from connection {}: {}", type.getSimpleName(), connectionId, reason);
                return reject(connectionId, reason, reportErrors);
            }
            return handler.apply(connectionId, request);
        }
    }
}
