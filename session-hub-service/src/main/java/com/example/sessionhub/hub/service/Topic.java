package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.ServerMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Fan-out channel for one session. Publishing is serialized per topic, so every subscriber
 * sees events in publish order.
 */
@Slf4j
public class Topic {

    private final UUID sessionId;
    private final int capacity;
    private final Set<TopicSubscription> subscriptions = new LinkedHashSet<>();
    private long published;

    Topic(UUID sessionId, int capacity) {
        this.sessionId = sessionId;
        this.capacity = capacity;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    synchronized TopicSubscription attach() {
        TopicSubscription subscription = new TopicSubscription(this, capacity);
        subscriptions.add(subscription);
        return subscription;
    }

    synchronized void detach(TopicSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            subscription.complete();
        }
    }

    /**
     * Delivers to every attached subscription. With none attached the event is dropped.
     */
    public synchronized void publish(ServerMessage message) {
        published++;
        if (subscriptions.isEmpty()) {
            log.trace("No subscribers for session {}, dropping {}", sessionId, message.getClass().getSimpleName());
            return;
        }
        for (TopicSubscription subscription : subscriptions) {
            subscription.deliver(message);
        }
    }

    public synchronized int subscriberCount() {
        return subscriptions.size();
    }

    public synchronized long publishedCount() {
        return published;
    }
}
