package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.ServerMessage;

import java.util.UUID;

/**
 * What a session output producer sees of the hub.
 */
public interface SessionEventSink {

    /** Fire-and-forget; never fails observably, even when nobody is subscribed. */
    void publish(UUID sessionId, ServerMessage event);

    /** Advisory; lets a producer skip work nobody is watching. */
    boolean hasSubscribers(UUID sessionId);
}
