package com.example.sessionhub.shared.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;
import java.util.UUID;

/**
 * Commands sent by a client over its connection. Tagged on the wire by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.Subscribe.class, name = "subscribe"),
        @JsonSubTypes.Type(value = ClientMessage.Unsubscribe.class, name = "unsubscribe"),
        @JsonSubTypes.Type(value = ClientMessage.Cancel.class, name = "cancel"),
        @JsonSubTypes.Type(value = ClientMessage.Ping.class, name = "ping")
})
public sealed interface ClientMessage
        permits ClientMessage.Subscribe, ClientMessage.Unsubscribe, ClientMessage.Cancel, ClientMessage.Ping {

    /** Join a session's topic. */
    record Subscribe(@JsonProperty(value = "session_id", required = true) UUID sessionId) implements ClientMessage {
        public Subscribe {
            Objects.requireNonNull(sessionId, "session_id is required");
        }
    }

    /** Leave a session's topic. */
    record Unsubscribe(@JsonProperty(value = "session_id", required = true) UUID sessionId) implements ClientMessage {
        public Unsubscribe {
            Objects.requireNonNull(sessionId, "session_id is required");
        }
    }

    /** Ask for a running session to be cancelled. */
    record Cancel(@JsonProperty(value = "session_id", required = true) UUID sessionId) implements ClientMessage {
        public Cancel {
            Objects.requireNonNull(sessionId, "session_id is required");
        }
    }

    /** Liveness check, answered with {@link ServerMessage.Pong}. */
    record Ping() implements ClientMessage {
    }
}
