package com.eyelevel.batchorchestrator.service.reconcile;

import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.Sleeper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationServiceTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;
    private final ReconciliationService service =
            new ReconciliationService(BackoffSchedule.defaults(), recordingSleeper, new ReconciliationRetryListener());

    @Test
    void confirmsOnThirdPollAfterTheScheduledDelays() {
        AtomicInteger polls = new AtomicInteger();

        ReconcileOutcome<Integer> outcome =
                service.awaitConfirmation("asset 7", polls::incrementAndGet, value -> value >= 3);

        assertThat(outcome.confirmed()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.lastValue()).isEqualTo(3);
        assertThat(sleeps).containsExactly(300L, 800L);
    }

    @Test
    void givesUpAfterTheLastScheduledAttempt() {
        AtomicInteger polls = new AtomicInteger();

        ReconcileOutcome<Integer> outcome =
                service.awaitConfirmation("asset 8", polls::incrementAndGet, value -> false);

        assertThat(outcome.confirmed()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(5);
        assertThat(outcome.lastValue()).isEqualTo(5);
        assertThat(sleeps).containsExactly(300L, 800L, 1500L, 2500L);
    }

    @Test
    void fetchFailureCountsAsAnUnconfirmedAttempt() {
        AtomicInteger polls = new AtomicInteger();

        ReconcileOutcome<String> outcome = service.awaitConfirmation("asset 9", () -> {
            if (polls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return "0xabc";
        }, "0xabc"::equals);

        assertThat(outcome.confirmed()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(sleeps).containsExactly(300L);
    }

    @Test
    void everyFetchFailingLeavesNoValue() {
        ReconcileOutcome<String> outcome = service.awaitConfirmation("asset 10", () -> {
            throw new IllegalStateException("down");
        }, value -> true, BackoffSchedule.zeroDelay(3));

        assertThat(outcome.confirmed()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.lastValue()).isNull();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void leadingDelayIsWaitedBeforeTheFirstPoll() {
        BackoffSchedule schedule = BackoffSchedule.ofMillis(List.of(2000L, 5000L));

        ReconcileOutcome<Integer> outcome = service.awaitConfirmation("quota", () -> 1, value -> false, schedule);

        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(sleeps).containsExactly(2000L, 5000L);
    }
}
