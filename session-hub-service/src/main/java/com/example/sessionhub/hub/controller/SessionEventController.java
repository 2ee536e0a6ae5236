package com.example.sessionhub.hub.controller;

import com.example.sessionhub.hub.dto.OutputRequest;
import com.example.sessionhub.hub.dto.StatusRequest;
import com.example.sessionhub.hub.dto.SubscriberPresenceResponse;
import com.example.sessionhub.hub.service.ConnectionHub;
import com.example.sessionhub.shared.protocol.ServerMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Publishing API for producers running outside this process.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
@Slf4j
public class SessionEventController {

    private final ConnectionHub connectionHub;

    @PostMapping("/output")
    public ResponseEntity<Void> publishOutput(@PathVariable UUID sessionId,
                                              @Valid @RequestBody OutputRequest request) {
        log.debug("Publishing {} output for session {}", request.getStream(), sessionId);
        connectionHub.publish(sessionId, new ServerMessage.Output(sessionId, request.getStream(), request.getContent()));
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/status")
    public ResponseEntity<Void> publishStatus(@PathVariable UUID sessionId,
                                              @Valid @RequestBody StatusRequest request) {
        log.info("Session {} changed status to {}", sessionId, request.getStatus());
        connectionHub.publish(sessionId, new ServerMessage.Status(sessionId, request.getStatus()));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/subscribers")
    public ResponseEntity<SubscriberPresenceResponse> getSubscribers(@PathVariable UUID sessionId) {
        int count = connectionHub.subscriberCount(sessionId);
        return ResponseEntity.ok(new SubscriberPresenceResponse(sessionId, count > 0, count));
    }
}
