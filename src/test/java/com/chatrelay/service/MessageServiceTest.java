package com.chatrelay.service;

import com.chatrelay.model.ChatMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(MessageService.class)
class MessageServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MessageService messageService;

    @Test
    void returnsOldestFirstWithinTheLimit() {
        for (int i = 0; i < 5; i++) {
            store("r1", "m" + i, T0.plusSeconds(i));
        }

        assertThat(messageService.fetchRecentMessages("r1", 3))
                .extracting(ChatMessage::getText)
                .containsExactly("m2", "m3", "m4");
    }

    @Test
    void ordersByTimestampNotInsertion() {
        store("r1", "late", T0.plusSeconds(10));
        store("r1", "early", T0);

        assertThat(messageService.fetchRecentMessages("r1", 10))
                .extracting(ChatMessage::getText)
                .containsExactly("early", "late");
    }

    @Test
    void equalTimestampsKeepInsertionOrder() {
        store("r1", "first", T0);
        store("r1", "second", T0);
        store("r1", "third", T0);

        assertThat(messageService.fetchRecentMessages("r1", 2))
                .extracting(ChatMessage::getText)
                .containsExactly("second", "third");
    }

    @Test
    void onlyReturnsTheRequestedRoom() {
        store("r1", "mine", T0);
        store("r2", "theirs", T0.plusSeconds(1));

        assertThat(messageService.fetchRecentMessages("r1", 10))
                .extracting(ChatMessage::getText)
                .containsExactly("mine");
        assertThat(messageService.fetchRecentMessages("empty", 10)).isEmpty();
    }

    @Test
    void zeroLimitReturnsNothing() {
        store("r1", "hidden", T0);

        assertThat(messageService.fetchRecentMessages("r1", 0)).isEmpty();
    }

    @Test
    void insertReportsSuccessAndAssignsSequence() {
        ChatMessage message = message("r1", "hello", T0);

        assertThat(messageService.insertMessage(message)).isTrue();
        assertThat(message.getSequence()).isNotNull();
    }

    private void store(String roomId, String text, Instant at) {
        assertThat(messageService.insertMessage(message(roomId, text, at))).isTrue();
    }

    private static ChatMessage message(String roomId, String text, Instant at) {
        return ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .roomId(roomId)
                .username("alice")
                .text(text)
                .timestamp(at)
                .build();
    }
}
