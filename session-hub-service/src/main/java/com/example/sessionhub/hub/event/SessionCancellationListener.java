package com.example.sessionhub.hub.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records cancellation requests. The status broadcast has already gone out by the time this runs.
 */
@Component
@Slf4j
public class SessionCancellationListener {

    @EventListener
    public void onCancelRequested(SessionCancelRequestedEvent event) {
        log.info("Cancellation requested for session {} by connection {}", event.getSessionId(), event.getConnectionId());
    }
}
