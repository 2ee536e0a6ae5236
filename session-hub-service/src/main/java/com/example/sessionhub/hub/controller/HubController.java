package com.example.sessionhub.hub.controller;

import com.example.sessionhub.hub.dto.HubStatsResponse;
import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.hub.service.TopicRegistry;
import com.example.sessionhub.hub.websocket.SessionWebSocketHandler;
import com.example.sessionhub.shared.config.AppProperties;
import com.example.sessionhub.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HubController {

    private final ConnectionHub connectionHub;
    private final TopicRegistry topicRegistry;
    private final SessionWebSocketHandler webSocketHandler;
    private final AppProperties appProperties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", Constants.HEALTH_OK));
    }

    @GetMapping("/hub/stats")
    public ResponseEntity<HubStatsResponse> getStats() {
        HubStatsResponse stats = HubStatsResponse.builder()
                .nodeName(appProperties.getNodeName())
                .connections(connectionHub.connectionCount())
                .webSocketConnections(webSocketHandler.activeConnectionCount())
                .topics(topicRegistry.topicCount())
                .topicCapacity(topicRegistry.getCapacity())
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.ok(stats);
    }
}
