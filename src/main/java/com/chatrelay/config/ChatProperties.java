package com.chatrelay.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings under the {@code chat.*} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /** Messages sent in {@code room_joined}. */
    @Min(0)
    private int historyLimit = 50;

    /** Upper bound for the {@code limit} parameter of the history endpoint. */
    @Min(1)
    private int maxPageSize = 200;

    /** STOMP handshake path. */
    @NotBlank
    private String endpoint = "/ws";

    /** Origin patterns allowed for the WebSocket endpoint and the REST API. */
    @NotEmpty
    private List<String> allowedOrigins = List.of("*");
}
