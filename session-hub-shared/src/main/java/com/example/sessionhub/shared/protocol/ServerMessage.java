package com.example.sessionhub.shared.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Events sent from the hub to a client. Session-scoped events travel through a topic;
 * the rest are direct responses to a command.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.Subscribed.class, name = "subscribed"),
        @JsonSubTypes.Type(value = ServerMessage.Unsubscribed.class, name = "unsubscribed"),
        @JsonSubTypes.Type(value = ServerMessage.Output.class, name = "output"),
        @JsonSubTypes.Type(value = ServerMessage.Status.class, name = "status"),
        @JsonSubTypes.Type(value = ServerMessage.Error.class, name = "error"),
        @JsonSubTypes.Type(value = ServerMessage.Pong.class, name = "pong")
})
public sealed interface ServerMessage
        permits ServerMessage.Subscribed, ServerMessage.Unsubscribed, ServerMessage.Output,
                ServerMessage.Status, ServerMessage.Error, ServerMessage.Pong {

    /**
     * The session this event belongs to, if any.
     */
    @JsonIgnore
    default Optional<UUID> session() {
        return Optional.empty();
    }

    record Subscribed(@JsonProperty("session_id") UUID sessionId) implements ServerMessage {
        public Subscribed {
            Objects.requireNonNull(sessionId, "session_id is required");
        }

        @Override
        public Optional<UUID> session() {
            return Optional.of(sessionId);
        }
    }

    record Unsubscribed(@JsonProperty("session_id") UUID sessionId) implements ServerMessage {
        public Unsubscribed {
            Objects.requireNonNull(sessionId, "session_id is required");
        }

        @Override
        public Optional<UUID> session() {
            return Optional.of(sessionId);
        }
    }

    /** One line of session output. */
    record Output(@JsonProperty("session_id") UUID sessionId,
                  @JsonProperty("stream") OutputStream stream,
                  @JsonProperty("content") String content) implements ServerMessage {
        public Output {
            Objects.requireNonNull(sessionId, "session_id is required");
            Objects.requireNonNull(stream, "stream is required");
            Objects.requireNonNull(content, "content is required");
        }

        @Override
        public Optional<UUID> session() {
            return Optional.of(sessionId);
        }
    }

    /** A session lifecycle transition. */
    record Status(@JsonProperty("session_id") UUID sessionId,
                  @JsonProperty("status") SessionStatus status) implements ServerMessage {
        public Status {
            Objects.requireNonNull(sessionId, "session_id is required");
            Objects.requireNonNull(status, "status is required");
        }

        @Override
        public Optional<UUID> session() {
            return Optional.of(sessionId);
        }
    }

    /** Non-fatal problem with the client's input or an operation. */
    record Error(@JsonProperty("message") String message) implements ServerMessage {
    }

    record Pong() implements ServerMessage {
    }
}
