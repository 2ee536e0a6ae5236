package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Connection records plus the {@link TopicRegistry}. Record mutations share the registry's
 * write lock, so topic and record structure change under one exclusive section.
 */
@Service
@Slf4j
public class ConnectionHub implements SessionEventSink {

    private final TopicRegistry topicRegistry;
    private final ReentrantReadWriteLock lock;
    private final Map<UUID, ConnectionRecord> connections = new HashMap<>();

    public ConnectionHub(TopicRegistry topicRegistry) {
        this.topicRegistry = topicRegistry;
        this.lock = topicRegistry.structureLock();
    }

    /**
     * Creates an empty record for the connection. Registering an id that already has a record is a no-op.
     */
    public void register(UUID connectionId) {
        ConnectionRecord existing;
        lock.writeLock().lock();
        try {
            existing = connections.putIfAbsent(connectionId, new ConnectionRecord(connectionId));
        } finally {
            lock.writeLock().unlock();
        }
        if (existing != null) {
            log.debug("Connection {} is already registered", connectionId);
            return;
        }
        log.debug("Registered connection {}", connectionId);
    }

    /**
     * Drops the connection's record, closes the handles it still held and reclaims any topic
     * left without subscribers. Other connections' handles are untouched.
     */
    public void unregister(UUID connectionId) {
        ConnectionRecord record;
        lock.writeLock().lock();
        try {
            record = connections.remove(connectionId);
        } finally {
            lock.writeLock().unlock();
        }
        if (record == null) {
            return;
        }

        // Closing takes topic monitors, which must not be acquired while holding the registry lock.
        List<TopicSubscription> handles = List.copyOf(record.getSubscriptions().values());
        handles.forEach(TopicSubscription::close);
        for (UUID sessionId : record.getSubscriptions().keySet()) {
            topicRegistry.removeIfOrphaned(sessionId);
        }
        log.debug("Unregistered connection {} after {} ({} subscriptions released)",
                connectionId, Duration.between(record.getConnectedAt(), Instant.now()), handles.size());
    }

    /**
     * Subscribes the connection to the session. A connection already holding a live handle for the
     * session gets that same handle back. Events published after this returns are delivered to it.
     */
    public TopicSubscription subscribe(UUID connectionId, UUID sessionId) {
        lock.writeLock().lock();
        try {
            ConnectionRecord record = connections.get(connectionId);
            if (record == null) {
                log.debug("Subscribe from unregistered connection {} to session {}; handle is not tracked",
                        connectionId, sessionId);
                return topicRegistry.subscribe(sessionId);
            }
            TopicSubscription existing = record.getSubscriptions().get(sessionId);
            if (existing != null && !existing.isDisposed()) {
                return existing;
            }
            TopicSubscription subscription = topicRegistry.subscribe(sessionId);
            record.getSubscriptions().put(sessionId, subscription);
            return subscription;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the session from the connection's record and returns the handle it held.
     * The handle is <em>not</em> closed; disposing of it is up to the caller.
     */
    public Optional<TopicSubscription> unsubscribe(UUID connectionId, UUID sessionId) {
        lock.writeLock().lock();
        try {
            ConnectionRecord record = connections.get(connectionId);
            if (record == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(record.getSubscriptions().remove(sessionId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void publish(UUID sessionId, ServerMessage event) {
        topicRegistry.publish(sessionId, event);
    }

    @Override
    public boolean hasSubscribers(UUID sessionId) {
        return topicRegistry.subscriberCount(sessionId) > 0;
    }

    public TopicSender getOrCreateSender(UUID sessionId) {
        return topicRegistry.getOrCreateSender(sessionId);
    }

    public int subscriberCount(UUID sessionId) {
        return topicRegistry.subscriberCount(sessionId);
    }

    /** Re-checks the session's topic after a handle went away. */
    public void releaseIfOrphaned(UUID sessionId) {
        topicRegistry.removeIfOrphaned(sessionId);
    }

    public Set<UUID> subscriptionsOf(UUID connectionId) {
        lock.readLock().lock();
        try {
            ConnectionRecord record = connections.get(connectionId);
            return record == null ? Set.of() : record.sessionIds();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(UUID connectionId) {
        lock.readLock().lock();
        try {
            return connections.containsKey(connectionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int topicCount() {
        return topicRegistry.topicCount();
    }
}
