package com.example.sessionhub.shared.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a session as reported to subscribers.
 */
public enum SessionStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Session status is required");
        }
        for (SessionStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
