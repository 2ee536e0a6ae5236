package com.example.sessionhub.hub.websocket;

import com.example.sessionhub.hub.event.SessionCancelRequestedEvent;
import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.hub.service.TopicSubscription;
import com.example.sessionhub.shared.exception.ProtocolException;
import com.example.sessionhub.shared.protocol.ClientMessage;
import com.example.sessionhub.shared.protocol.ProtocolCodec;
import com.example.sessionhub.shared.protocol.ServerMessage;
import com.example.sessionhub.shared.protocol.SessionStatus;
import com.example.sessionhub.shared.util.Constants;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;
import reactor.util.concurrent.Queues;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Protocol state for one physical connection.
 * <p>
 * Inbound frames are decoded and dispatched to the {@link ConnectionHub}. Outbound, direct replies
 * (acks, pongs, errors) and one relay per subscribed session are merged into a single ordered
 * stream of encoded frames, see {@link #outbound()}.
 * <p>
 * Unsubscribing detaches the session's handle from its topic but lets events already buffered in
 * it drain, so a few events may still arrive after the {@code unsubscribed} ack.
 */
@Slf4j
public class ConnectionMultiplexer {

    public enum State {
        OPEN,
        CLOSING,
        CLOSED
    }

    /** Events a relay pulls from its handle ahead of the socket. */
    static final int RELAY_PREFETCH = 32;

    /** Direct replies queued for a client that is not reading; overflowing it closes the connection. */
    static final int REPLY_CAPACITY = 256;

    @Getter
    private final UUID connectionId;
    private final ConnectionHub hub;
    private final ProtocolCodec codec;
    private final ApplicationEventPublisher eventPublisher;
    private final Scheduler relayScheduler;

    // Written only from synchronized onFrame; the queue is single-producer.
    private final Sinks.Many<ServerMessage> replies =
            Sinks.many().unicast().onBackpressureBuffer(Queues.<ServerMessage>get(REPLY_CAPACITY).get());
    private final Sinks.Many<Flux<ServerMessage>> relays = Sinks.many().unicast().onBackpressureBuffer();
    private final Map<UUID, TopicSubscription> activeRelays = new ConcurrentHashMap<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private final Flux<String> outbound;

    private ConnectionMultiplexer(UUID connectionId, ConnectionHub hub, ProtocolCodec codec,
                                  ApplicationEventPublisher eventPublisher, Scheduler relayScheduler) {
        this.connectionId = connectionId;
        this.hub = hub;
        this.codec = codec;
        this.eventPublisher = eventPublisher;
        this.relayScheduler = relayScheduler;
        this.outbound = Flux.merge(
                        replies.asFlux(),
                        relays.asFlux().flatMap(Function.identity(), Integer.MAX_VALUE))
                .handle((ServerMessage message, SynchronousSink<String> sink) -> {
                    try {
                        sink.next(codec.encode(message));
                    } catch (IllegalStateException e) {
                        log.error("Dropping unencodable {} for connection {}", message.getClass().getSimpleName(), connectionId);
                    }
                });
    }

    /**
     * Registers the connection with the hub and returns its multiplexer in the OPEN state.
     */
    public static ConnectionMultiplexer open(UUID connectionId, ConnectionHub hub, ProtocolCodec codec,
                                             ApplicationEventPublisher eventPublisher, Scheduler relayScheduler) {
        hub.register(connectionId);
        return new ConnectionMultiplexer(connectionId, hub, codec, eventPublisher, relayScheduler);
    }

    /**
     * Encoded frames to send to the client. Subscribe once; cancelling the subscription stops every relay.
     */
    public Flux<String> outbound() {
        return outbound;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Handles one inbound text frame. Malformed frames are answered with an {@code error} event and
     * the connection stays open.
     */
    public synchronized void onFrame(String frame) {
        if (state.get() != State.OPEN) {
            log.debug("Ignoring frame on connection {} in state {}", connectionId, state.get());
            return;
        }
        MDC.put(Constants.CONNECTION_ID_KEY, connectionId.toString());
        try {
            ClientMessage message;
            try {
                message = codec.decode(frame);
            } catch (ProtocolException e) {
                log.warn("Connection {} sent a malformed frame: {}", connectionId, e.getMessage());
                reply(new ServerMessage.Error(e.getMessage()));
                return;
            }
            dispatch(message);
        } finally {
            MDC.remove(Constants.CONNECTION_ID_KEY);
        }
    }

    void dispatch(ClientMessage message) {
        if (message instanceof ClientMessage.Subscribe subscribe) {
            onSubscribe(subscribe.sessionId());
        } else if (message instanceof ClientMessage.Unsubscribe unsubscribe) {
            onUnsubscribe(unsubscribe.sessionId());
        } else if (message instanceof ClientMessage.Cancel cancel) {
            onCancel(cancel.sessionId());
        } else if (message instanceof ClientMessage.Ping) {
            reply(new ServerMessage.Pong());
        }
    }

    private void onSubscribe(UUID sessionId) {
        log.info("Connection {} subscribing to session {}", connectionId, sessionId);
        TopicSubscription subscription = hub.subscribe(connectionId, sessionId);
        if (activeRelays.get(sessionId) != subscription) {
            activeRelays.put(sessionId, subscription);
            relays.tryEmitNext(relay(sessionId, subscription));
        } else {
            log.debug("Connection {} already relays session {}", connectionId, sessionId);
        }
        reply(new ServerMessage.Subscribed(sessionId));
    }

    private void onUnsubscribe(UUID sessionId) {
        log.info("Connection {} unsubscribing from session {}", connectionId, sessionId);
        hub.unsubscribe(connectionId, sessionId).ifPresent(subscription -> {
            activeRelays.remove(sessionId, subscription);
            subscription.close();
        });
        reply(new ServerMessage.Unsubscribed(sessionId));
    }

    private void onCancel(UUID sessionId) {
        log.info("Connection {} requesting cancel for session {}", connectionId, sessionId);
        hub.publish(sessionId, new ServerMessage.Status(sessionId, SessionStatus.CANCELLED));
        eventPublisher.publishEvent(new SessionCancelRequestedEvent(this, sessionId, connectionId));
    }

    private Flux<ServerMessage> relay(UUID sessionId, TopicSubscription subscription) {
        return subscription.events()
                .publishOn(relayScheduler, RELAY_PREFETCH)
                .doOnNext(event -> log.trace("Relaying {} of session {} to connection {}",
                        event.getClass().getSimpleName(), sessionId, connectionId))
                .doFinally(signal -> {
                    activeRelays.remove(sessionId, subscription);
                    hub.releaseIfOrphaned(sessionId);
                    log.debug("Relay of session {} to connection {} ended ({})", sessionId, connectionId, signal);
                });
    }

    private void reply(ServerMessage message) {
        Sinks.EmitResult result = replies.tryEmitNext(message);
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("Connection {} has {} unread replies queued, closing it", connectionId, REPLY_CAPACITY);
            close();
        } else if (result.isFailure()) {
            log.debug("Could not queue {} for connection {}: {}", message.getClass().getSimpleName(), connectionId, result);
        }
    }

    /**
     * Transport is gone: stops accepting commands, ends every relay and unregisters from the hub.
     * Idempotent.
     */
    public synchronized void close() {
        if (!state.compareAndSet(State.OPEN, State.CLOSING)) {
            return;
        }
        log.debug("Closing connection {}", connectionId);
        replies.tryEmitComplete();
        relays.tryEmitComplete();
        activeRelays.values().forEach(TopicSubscription::close);
        activeRelays.clear();
        hub.unregister(connectionId);
        state.set(State.CLOSED);
    }
}
