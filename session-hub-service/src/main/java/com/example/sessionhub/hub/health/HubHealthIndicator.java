package com.example.sessionhub.hub.health;

import com.example.sessionhub.hub.service.ConnectionHub;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the hub's connection and topic counts on the actuator health endpoint.
 */
@Component
@RequiredArgsConstructor
public class HubHealthIndicator implements HealthIndicator {

    private final ConnectionHub connectionHub;

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("connections", connectionHub.connectionCount())
                    .withDetail("topics", connectionHub.topicCount())
                    .build();
        } catch (Exception e) {
            return Health.down(e).build();
        }
    }
}
