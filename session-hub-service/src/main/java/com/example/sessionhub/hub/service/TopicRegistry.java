package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.config.AppProperties;
import com.example.sessionhub.shared.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Session id to {@link Topic} map. Topics are created lazily on first subscribe or publish and
 * reclaimed once orphaned. Structural changes take the write lock; lookups take the read lock.
 * Topic monitors are always acquired after this lock, never before.
 */
@Component
@Slf4j
public class TopicRegistry {

    private final int capacity;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<UUID, Topic> topics = new HashMap<>();

    @Autowired
    public TopicRegistry(AppProperties appProperties) {
        this(appProperties.getTopic().getCapacity());
    }

    public TopicRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Topic capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Returns a sender for the session, creating its topic if needed. The sender resolves the live
     * topic on every publish, so it stays valid across reclamation of the topic.
     */
    public TopicSender getOrCreateSender(UUID sessionId) {
        getOrCreate(sessionId);
        return new RoutingSender(sessionId);
    }

    /**
     * Delivers to the session's topic, creating it if needed. Never blocks on subscribers.
     */
    public void publish(UUID sessionId, ServerMessage message) {
        Topic topic = find(sessionId);
        if (topic == null) {
            topic = getOrCreate(sessionId);
        }
        // Published outside the registry lock; the topic serializes its own deliveries.
        topic.publish(message);
        if (topic.subscriberCount() == 0) {
            removeIfOrphaned(sessionId);
        }
    }

    /**
     * Attaches a new subscription to the session's topic, creating the topic if needed. Runs inside
     * the write lock so a concurrent {@link #removeIfOrphaned(UUID)} cannot drop the topic in between.
     */
    public TopicSubscription subscribe(UUID sessionId) {
        lock.writeLock().lock();
        try {
            return topics.computeIfAbsent(sessionId, this::newTopic).attach();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the session's topic if it has no subscribers. Safe to call redundantly.
     *
     * @return true if a topic was removed
     */
    public boolean removeIfOrphaned(UUID sessionId) {
        lock.writeLock().lock();
        try {
            Topic topic = topics.get(sessionId);
            if (topic != null && topic.subscriberCount() == 0) {
                topics.remove(sessionId);
                log.debug("Reclaimed orphaned topic for session {} after {} events", sessionId, topic.publishedCount());
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every orphaned topic.
     *
     * @return the number of topics reclaimed
     */
    public int removeOrphans() {
        lock.writeLock().lock();
        try {
            int before = topics.size();
            topics.values().removeIf(topic -> topic.subscriberCount() == 0);
            return before - topics.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Advisory; may be stale by the time the caller acts on it. */
    public int subscriberCount(UUID sessionId) {
        Topic topic = find(sessionId);
        return topic == null ? 0 : topic.subscriberCount();
    }

    public boolean contains(UUID sessionId) {
        return find(sessionId) != null;
    }

    public int topicCount() {
        lock.readLock().lock();
        try {
            return topics.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<UUID> sessionIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(topics.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /** The lock guarding the topic map; the hub takes it to mutate connection records under the same section. */
    ReentrantReadWriteLock structureLock() {
        return lock;
    }

    private Topic find(UUID sessionId) {
        lock.readLock().lock();
        try {
            return topics.get(sessionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Topic getOrCreate(UUID sessionId) {
        lock.writeLock().lock();
        try {
            return topics.computeIfAbsent(sessionId, this::newTopic);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Topic newTopic(UUID sessionId) {
        log.debug("Creating topic for session {} with capacity {}", sessionId, capacity);
        return new Topic(sessionId, capacity);
    }

    private final class RoutingSender implements TopicSender {

        private final UUID sessionId;

        private RoutingSender(UUID sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public UUID getSessionId() {
            return sessionId;
        }

        @Override
        public void publish(ServerMessage message) {
            TopicRegistry.this.publish(sessionId, message);
        }

        @Override
        public boolean hasSubscribers() {
            return subscriberCount(sessionId) > 0;
        }
    }
}
