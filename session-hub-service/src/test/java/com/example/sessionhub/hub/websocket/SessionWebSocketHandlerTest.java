package com.example.sessionhub.hub.websocket;

import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.shared.protocol.OutputStream;
import com.example.sessionhub.shared.protocol.ServerMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SessionWebSocketHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @LocalServerPort
    private int port;

    @Autowired
    private ConnectionHub connectionHub;

    @Autowired
    private ObjectMapper objectMapper;

    private final WebSocketClient client = new ReactorNettyWebSocketClient();

    @Test
    void pingIsAnsweredWithPong() {
        List<ServerMessage> received = new CopyOnWriteArrayList<>();

        client.execute(uri(), session -> session.send(Mono.just(session.textMessage("{\"type\":\"ping\"}")))
                        .and(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .map(this::read)
                                .take(1)
                                .doOnNext(received::add)))
                .block(TIMEOUT);

        assertThat(received).containsExactly(new ServerMessage.Pong());
    }

    @Test
    void malformedFrameDoesNotCloseTheConnection() {
        List<ServerMessage> received = new CopyOnWriteArrayList<>();

        client.execute(uri(), session -> session.send(Flux.just("not json", "{\"type\":\"ping\"}").map(session::textMessage))
                        .and(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .map(this::read)
                                .take(2)
                                .doOnNext(received::add)))
                .block(TIMEOUT);

        assertThat(received).hasSize(2);
        assertThat(received.get(0)).isInstanceOfSatisfying(ServerMessage.Error.class,
                error -> assertThat(error.message()).startsWith("Invalid message format: "));
        assertThat(received.get(1)).isEqualTo(new ServerMessage.Pong());
    }

    @Test
    void subscriberReceivesPublishedOutputAndIsReleasedOnDisconnect() {
        UUID sessionId = UUID.randomUUID();
        ServerMessage hello = new ServerMessage.Output(sessionId, OutputStream.STDOUT, "hello");
        List<ServerMessage> received = new CopyOnWriteArrayList<>();

        client.execute(uri(), session -> session.send(Mono.just(session.textMessage(subscribe(sessionId))))
                        .and(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .map(this::read)
                                .doOnNext(message -> {
                                    received.add(message);
                                    if (message instanceof ServerMessage.Subscribed) {
                                        connectionHub.publish(sessionId, hello);
                                    }
                                })
                                .take(2)))
                .block(TIMEOUT);

        assertThat(received).containsExactly(new ServerMessage.Subscribed(sessionId), hello);
        awaitNoSubscribers(sessionId);
    }

    private void awaitNoSubscribers(UUID sessionId) {
        Mono<Boolean> released = Mono.fromCallable(() -> connectionHub.hasSubscribers(sessionId))
                .filter(hasSubscribers -> !hasSubscribers)
                .repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(20)));

        StepVerifier.create(released)
                .expectNext(false)
                .expectComplete()
                .verify(TIMEOUT);
    }

    private URI uri() {
        return URI.create("ws://localhost:" + port + "/ws");
    }

    private String subscribe(UUID sessionId) {
        return "{\"type\":\"subscribe\",\"session_id\":\"" + sessionId + "\"}";
    }

    private ServerMessage read(String frame) {
        try {
            return objectMapper.readValue(frame, ServerMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
