package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.ServerMessage;

import java.util.UUID;

/**
 * Publishing side of a session's topic, handed to producers.
 */
public interface TopicSender {

    UUID getSessionId();

    /** Fire-and-forget; never blocks and never fails when nobody is listening. */
    void publish(ServerMessage message);

    boolean hasSubscribers();
}
