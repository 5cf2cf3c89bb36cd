package com.chatrelay.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "messages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

    public static final int MAX_TEXT_LENGTH = 2000;

    /** Insertion order; breaks ties between messages sharing a timestamp. */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq")
    private Long sequence;

    @Column(nullable = false, unique = true, length = 36)
    private String id;

    @Column(nullable = false)
    private String roomId;

    @Column(nullable = false)
    private String username;

    @Column(name = "message", nullable = false, length = MAX_TEXT_LENGTH)
    private String text;

    @Column(name = "sent_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
