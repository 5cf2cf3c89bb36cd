package com.chatrelay;

import com.chatrelay.service.RoomDirectory;
import com.chatrelay.service.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;
import org.springframework.web.socket.sockjs.client.SockJsClient;
import org.springframework.web.socket.sockjs.client.WebSocketTransport;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the relay over a real STOMP connection, the way a browser client would.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ChatRelayApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private RoomDirectory roomDirectory;

    private final List<StompSession> opened = new ArrayList<>();

    @AfterEach
    void disconnectAll() {
        opened.stream().filter(StompSession::isConnected).forEach(StompSession::disconnect);
    }

    @Test
    void joinChatAndLeaveOverStomp() throws Exception {
        Client alice = connect();
        Client bob = connect();

        alice.send("join_room", Map.of("username", "alice", "roomId", "e2e"));
        Map<String, Object> aliceJoined = alice.next("room_joined");
        assertThat(aliceJoined.get("roomId")).isEqualTo("e2e");
        assertThat((List<?>) aliceJoined.get("users")).hasSize(1);
        assertThat(alice.next("user_joined").get("username")).isEqualTo("alice");

        bob.send("join_room", Map.of("username", "bob", "room_id", "e2e"));
        assertThat((List<?>) bob.next("room_joined").get("users")).hasSize(2);
        assertThat(alice.next("user_joined").get("username")).isEqualTo("bob");

        bob.send("typing", Map.of("roomId", "e2e", "isTyping", true));
        Map<String, Object> typing = alice.next("user_typing");
        assertThat(typing.get("username")).isEqualTo("bob");
        assertThat(typing.get("isTyping")).isEqualTo(true);

        alice.send("send_message", Map.of("roomId", "e2e", "text", "hi bob"));
        Map<String, Object> received = bob.next("new_message");
        assertThat(received.get("username")).isEqualTo("alice");
        assertThat(received.get("message")).isEqualTo("hi bob");
        assertThat(received.get("id")).isNotNull();
        assertThat(alice.next("new_message").get("id")).isEqualTo(received.get("id"));

        ResponseEntity<List<Map<String, Object>>> history = restTemplate.exchange(
                "/api/rooms/e2e/messages", HttpMethod.GET, null,
                new ParameterizedTypeReference<List<Map<String, Object>>>() {});
        assertThat(history.getBody())
                .extracting(m -> m.get("message"))
                .containsExactly("hi bob");

        alice.send("leave_room", Map.of("roomId", "e2e"));
        Map<String, Object> left = bob.next("user_left");
        assertThat(left.get("username")).isEqualTo("alice");
        assertThat((List<?>) left.get("users")).hasSize(1);
    }

    @Test
    void subscribingToConnectedDeliversTheAck() throws Exception {
        Client frank = connect();

        assertThat(frank.next("connected").get("message")).isEqualTo("Connected to server");
    }

    @Test
    void badFramesAreAnsweredWithErrors() throws Exception {
        Client carol = connect();

        carol.send("join_room", Map.of("roomId", "e2e-errors"));
        assertThat((String) carol.next("error").get("message")).contains("username");

        carol.send("send_message", Map.of("roomId", "e2e-errors", "text", "anyone?"));
        assertThat(carol.next("error").get("message")).isEqualTo("Join a room before sending messages");

        carol.send("dance", Map.of());
        assertThat(carol.next("error").get("message")).isEqualTo("Unsupported event: dance");

        carol.session.send("/app/join_room", List.of("carol", "e2e-errors"));
        assertThat(carol.next("error").get("message")).isEqualTo("Malformed payload");
    }

    @Test
    void closingTheConnectionReleasesPresence() throws Exception {
        Client dave = connect();
        Client erin = connect();
        dave.send("join_room", Map.of("username", "dave", "roomId", "e2e-close"));
        dave.next("room_joined");
        erin.send("join_room", Map.of("username", "erin", "roomId", "e2e-close"));
        erin.next("room_joined");

        dave.session.disconnect();

        assertThat(erin.next("user_left").get("username")).isEqualTo("dave");
        assertThat(roomDirectory.listMembers("e2e-close")).hasSize(1);
        assertThat(sessionRegistry.usernamesInRoom("e2e-close")).containsExactly("erin");
    }

    @Test
    void restApiCreatesAndListsRooms() {
        ResponseEntity<Map> created = restTemplate.postForEntity("/api/rooms",
                Map.of("name", "Integration", "createdBy", "tester"), Map.class);
        assertThat(created.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(created.getBody()).containsEntry("name", "Integration");

        ResponseEntity<List<Map<String, Object>>> rooms = restTemplate.exchange(
                "/api/rooms", HttpMethod.GET, null,
                new ParameterizedTypeReference<List<Map<String, Object>>>() {});
        assertThat(rooms.getBody())
                .extracting(r -> r.get("name"))
                .contains("Integration");
    }

    private Client connect() throws Exception {
        WebSocketStompClient stompClient = new WebSocketStompClient(
                new SockJsClient(List.of(new WebSocketTransport(new StandardWebSocketClient()))));
        stompClient.setMessageConverter(new MappingJackson2MessageConverter());
        StompSession session = stompClient
                .connectAsync("http://localhost:" + port + "/ws", new StompSessionHandlerAdapter() {})
                .get(5, TimeUnit.SECONDS);
        opened.add(session);
        return new Client(session);
    }

    /** One STOMP connection with a queue per subscribed event. */
    private static final class Client {
        private static final List<String> EVENTS = List.of(
                "room_joined", "user_joined", "user_left", "new_message", "user_typing", "error");

        private final StompSession session;
        private final Map<String, BlockingQueue<Map<String, Object>>> inbox = new HashMap<>();

        Client(StompSession session) {
            this.session = session;
            for (String event : EVENTS) {
                subscribe(event, "/user/queue/" + event);
            }
            subscribe("connected", "/app/connected");
        }

        private void subscribe(String event, String destination) {
            BlockingQueue<Map<String, Object>> queue = new LinkedBlockingQueue<>();
            inbox.put(event, queue);
            session.subscribe(destination, new StompFrameHandler() {
                @Override
                public Type getPayloadType(StompHeaders headers) {
                    return Map.class;
                }

                @Override
                @SuppressWarnings("unchecked")
                public void handleFrame(StompHeaders headers, Object payload) {
                    queue.add((Map<String, Object>) payload);
                }
            });
        }

        void send(String event, Map<String, Object> body) {
            session.send("/app/" + event, body);
        }

        Map<String, Object> next(String event) throws InterruptedException {
            Map<String, Object> payload = inbox.get(event).poll(5, TimeUnit.SECONDS);
            assertThat(payload).as("%s within 5s", event).isNotNull();
            return payload;
        }
    }
}
