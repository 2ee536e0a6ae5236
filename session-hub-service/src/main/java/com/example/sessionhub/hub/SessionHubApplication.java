package com.example.sessionhub.hub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Session event hub.
 *
 * Clients connect over WebSocket, subscribe to sessions and receive their output and status
 * changes live. Producers publish into the hub in-process through
 * {@link com.example.sessionhub.hub.service.SessionEventSink} or over the HTTP API.
 */
@SpringBootApplication(scanBasePackages = "com.example.sessionhub")
@EnableScheduling
public class SessionHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionHubApplication.class, args);
    }
}
