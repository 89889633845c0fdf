package com.eyelevel.batchorchestrator.service.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Evicts sessions that have been idle for too long and have no batch running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionCleanupScheduler {

    private final BatchSessionStore batchSessionStore;

    @Value("${app.session.idle-timeout-minutes}")
    private long idleTimeoutMinutes;

    @Scheduled(cron = "${app.scheduler.stale-session}")
    public void evictIdleSessions() {
        final Instant threshold = Instant.now().minus(idleTimeoutMinutes, ChronoUnit.MINUTES);
        log.debug("Running stale session cleanup for sessions idle since {}.", threshold);
        final int evicted = batchSessionStore.evictIdle(threshold);
        if (evicted > 0) {
            log.info("Evicted {} idle sessions; {} remain.", evicted, batchSessionStore.size());
        }
    }
}
