package com.eyelevel.batchorchestrator.service.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StaleSessionCleanupSchedulerTest {

    @Mock
    private BatchSessionStore batchSessionStore;

    @Test
    void evictsSessionsIdleLongerThanTheTimeout() {
        StaleSessionCleanupScheduler cleanup = new StaleSessionCleanupScheduler(batchSessionStore);
        ReflectionTestUtils.setField(cleanup, "idleTimeoutMinutes", 120L);
        Instant before = Instant.now();

        cleanup.evictIdleSessions();

        ArgumentCaptor<Instant> threshold = ArgumentCaptor.forClass(Instant.class);
        verify(batchSessionStore).evictIdle(threshold.capture());
        assertThat(Duration.between(threshold.getValue(), before).toMinutes()).isBetween(119L, 120L);
    }
}
