package com.example.sessionhub.hub.service;

import lombok.Getter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Subscriptions held by one physical connection. Guarded by the registry's structure lock.
 */
@Getter
class ConnectionRecord {

    private final UUID connectionId;
    private final Instant connectedAt;
    private final Map<UUID, TopicSubscription> subscriptions = new HashMap<>();

    ConnectionRecord(UUID connectionId) {
        this.connectionId = connectionId;
        this.connectedAt = Instant.now();
    }

    Set<UUID> sessionIds() {
        return Set.copyOf(subscriptions.keySet());
    }
}
