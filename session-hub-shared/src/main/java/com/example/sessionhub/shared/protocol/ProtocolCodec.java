package com.example.sessionhub.shared.protocol;

import com.example.sessionhub.shared.exception.ProtocolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts between text frames and protocol messages.
 */
@Component
@Slf4j
public class ProtocolCodec {

    static final String INVALID_FORMAT_PREFIX = "Invalid message format: ";

    private final ObjectMapper objectMapper;

    public ProtocolCodec(ObjectMapper objectMapper) {
        // Pong and Ping carry no fields besides their tag.
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Decodes one inbound frame.
     *
     * @throws ProtocolException if the frame is not a well-formed command
     */
    public ClientMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException(INVALID_FORMAT_PREFIX + "empty frame", null, frame);
        }
        try {
            ClientMessage message = objectMapper.readValue(frame, ClientMessage.class);
            if (message == null) {
                throw new ProtocolException(INVALID_FORMAT_PREFIX + "null message", null, frame);
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new ProtocolException(INVALID_FORMAT_PREFIX + e.getOriginalMessage(), e, frame);
        }
    }

    /**
     * Encodes one outbound event.
     *
     * @throws IllegalStateException if the event cannot be serialized
     */
    public String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message: {}", message.getClass().getSimpleName(), e.getMessage());
            throw new IllegalStateException("Failed to serialize message", e);
        }
    }
}
