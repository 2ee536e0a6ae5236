package com.example.sessionhub.hub.metrics;

import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.hub.websocket.SessionWebSocketHandler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exports connection and topic gauges of the hub.
 */
@Component
@RequiredArgsConstructor
public class HubMetrics implements MeterBinder {

    private final ConnectionHub connectionHub;
    private final SessionWebSocketHandler webSocketHandler;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("hub.connections", connectionHub, ConnectionHub::connectionCount)
            .description("Connections registered with the hub.")
            .register(registry);
        Gauge.builder("hub.websocket.connections", webSocketHandler, SessionWebSocketHandler::activeConnectionCount)
            .description("Open WebSocket connections on this node.")
            .register(registry);
        Gauge.builder("hub.topics", connectionHub, ConnectionHub::topicCount)
            .description("Session topics currently held in memory.")
            .register(registry);
    }
}
