package com.example.sessionhub.hub.websocket;

import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.shared.protocol.ProtocolCodec;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds each WebSocket to a {@link ConnectionMultiplexer}. The connection ends when the client
 * closes its side or when a send fails; either way the multiplexer is closed and unregistered.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionWebSocketHandler implements WebSocketHandler {

    private final ConnectionHub connectionHub;
    private final ProtocolCodec protocolCodec;
    private final ApplicationEventPublisher eventPublisher;
    @Qualifier("relayScheduler")
    private final Scheduler relayScheduler;

    private final Map<UUID, ConnectionMultiplexer> connections = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        UUID connectionId = UUID.randomUUID();
        ConnectionMultiplexer multiplexer = ConnectionMultiplexer.open(
                connectionId, connectionHub, protocolCodec, eventPublisher, relayScheduler);
        connections.put(connectionId, multiplexer);
        log.info("WebSocket connection established: {} from {}", connectionId, session.getHandshakeInfo().getRemoteAddress());

        Mono<Void> input = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(multiplexer::onFrame)
                // The multiplexer closes itself when the client stops reading its replies.
                .takeUntil(frame -> multiplexer.getState() != ConnectionMultiplexer.State.OPEN)
                .then();

        Mono<Void> output = session.send(multiplexer.outbound().map(session::textMessage));

        return Mono.firstWithSignal(input, output)
                .onErrorResume(e -> {
                    log.warn("WebSocket connection {} failed: {}", connectionId, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    connections.remove(connectionId);
                    multiplexer.close();
                    log.info("WebSocket connection closed: {}", connectionId);
                });
    }

    public int activeConnectionCount() {
        return connections.size();
    }

    @PreDestroy
    public void cleanup() {
        if (connections.isEmpty()) {
            return;
        }
        log.info("Closing {} WebSocket connections for shutdown...", connections.size());
        new ArrayList<>(connections.values()).forEach(ConnectionMultiplexer::close);
        connections.clear();
    }
}
