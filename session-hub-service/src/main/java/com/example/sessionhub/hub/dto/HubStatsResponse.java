package com.example.sessionhub.hub.dto;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class HubStatsResponse {
    private final String nodeName;
    private final int connections;
    private final int webSocketConnections;
    private final int topics;
    private final int topicCapacity;
    private final OffsetDateTime timestamp;
}
