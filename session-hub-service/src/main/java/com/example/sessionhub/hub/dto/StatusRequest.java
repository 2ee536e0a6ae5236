package com.example.sessionhub.hub.dto;

import com.example.sessionhub.shared.protocol.SessionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusRequest {

    @NotNull(message = "Status is required")
    private SessionStatus status;
}
