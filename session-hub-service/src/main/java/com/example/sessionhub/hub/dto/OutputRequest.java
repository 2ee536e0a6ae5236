package com.example.sessionhub.hub.dto;

import com.example.sessionhub.shared.protocol.OutputStream;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of session output pushed by a producer. The stream defaults to stdout.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutputRequest {

    @NotNull(message = "Stream must be stdout or stderr")
    private OutputStream stream = OutputStream.STDOUT;

    @NotNull(message = "Content is required")
    private String content;
}
