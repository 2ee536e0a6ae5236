package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live handle onto one {@link Topic}. Events published after the handle was attached are buffered
 * (up to the topic capacity, dropping the oldest) until read through {@link #events()}.
 * <p>
 * {@link #close()} detaches the handle: no further events are accepted, the ones already buffered
 * are still delivered, then the event stream completes.
 */
@Slf4j
public class TopicSubscription implements Disposable {

    private final Topic topic;
    private final DropOldestQueue<ServerMessage> buffer;
    private final Sinks.Many<ServerMessage> sink;
    private final AtomicBoolean closed = new AtomicBoolean();

    TopicSubscription(Topic topic, int capacity) {
        this.topic = topic;
        this.buffer = new DropOldestQueue<>(capacity);
        this.sink = Sinks.many().unicast().onBackpressureBuffer(buffer);
    }

    public UUID getSessionId() {
        return topic.getSessionId();
    }

    /**
     * The events of this subscription. May be subscribed to only once; cancelling it closes the handle.
     */
    public Flux<ServerMessage> events() {
        return sink.asFlux().doFinally(signal -> close());
    }

    /** Events evicted from this handle's buffer because its reader fell behind. */
    public long droppedCount() {
        return buffer.dropped();
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            topic.detach(this);
        }
    }

    @Override
    public void dispose() {
        close();
    }

    @Override
    public boolean isDisposed() {
        return closed.get();
    }

    // Called with the topic's monitor held, which serializes every emission into the sink.
    void deliver(ServerMessage message) {
        long droppedBefore = buffer.dropped();
        Sinks.EmitResult result = sink.tryEmitNext(message);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_CANCELLED && result != Sinks.EmitResult.FAIL_TERMINATED) {
            log.warn("Failed to deliver event to subscriber of session {}: {}", getSessionId(), result);
        } else if (buffer.dropped() > droppedBefore) {
            log.debug("Subscriber of session {} is lagging; dropped oldest buffered event ({} dropped so far)",
                    getSessionId(), buffer.dropped());
        }
    }

    void complete() {
        sink.tryEmitComplete();
    }
}
