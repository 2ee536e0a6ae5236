package com.example.sessionhub.hub.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a client asks for a session to be cancelled. Stopping the session's producer
 * is left to whoever listens for this event.
 */
public class SessionCancelRequestedEvent extends ApplicationEvent {

    private final UUID sessionId;
    private final UUID connectionId;

    public SessionCancelRequestedEvent(Object source, UUID sessionId, UUID connectionId) {
        super(source);
        this.sessionId = sessionId;
        this.connectionId = connectionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getConnectionId() {
        return connectionId;
    }
}
