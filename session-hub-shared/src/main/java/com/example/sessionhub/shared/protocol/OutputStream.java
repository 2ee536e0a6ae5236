package com.example.sessionhub.shared.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which output stream of a session a line came from.
 * Serialized as {@code stdout}/{@code stderr}; {@code primary}/{@code error} are accepted as aliases.
 */
public enum OutputStream {
    STDOUT("stdout", "primary"),
    STDERR("stderr", "error");

    private final String wireName;
    private final String alias;

    OutputStream(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OutputStream fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output stream is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OutputStream stream : values()) {
            if (stream.wireName.equals(normalized) || stream.alias.equals(normalized)) {
                return stream;
            }
        }
        throw new IllegalArgumentException("Unknown output stream: " + value);
    }
}
