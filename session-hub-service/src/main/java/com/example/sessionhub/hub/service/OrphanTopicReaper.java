package com.example.sessionhub.hub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically reclaims topics nobody subscribes to, such as those created by a publish
 * or a producer's sender for a session no client is watching.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrphanTopicReaper {

    private final TopicRegistry topicRegistry;

    @Scheduled(fixedRateString = "${hub.reaper.interval-ms:60000}")
    public void reapOrphanedTopics() {
        log.trace("Running orphaned topic sweep...");
        try {
            int reclaimed = topicRegistry.removeOrphans();
            if (reclaimed > 0) {
                log.info("Reclaimed {} orphaned topics, {} remain", reclaimed, topicRegistry.topicCount());
            }
        } catch (Exception e) {
            log.error("Error during orphaned topic sweep", e);
        }
    }
}
