package com.example.sessionhub.hub.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class SubscriberPresenceResponse {
    private final UUID sessionId;
    private final boolean hasSubscribers;
    private final int subscriberCount;
}
