package com.example.sessionhub.shared.exception;

import lombok.Getter;

/**
 * Raised when an inbound frame cannot be decoded into a command.
 * Keeps the offending frame so the failure can be logged with its context.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private final String frame;

    public ProtocolException(String message, Throwable cause, String frame) {
        super(message, cause);
        this.frame = frame;
    }
}
