package com.eyelevel.batchorchestrator.service.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * A {@link BackOffPolicy} that waits the delays of a {@link BackoffSchedule} in order. The first
 * entry of the schedule is the delay before the first attempt and is not applied here.
 */
@Slf4j
public class ScheduleBackOffPolicy implements BackOffPolicy {

    private final BackoffSchedule schedule;
    private final Sleeper sleeper;

    public ScheduleBackOffPolicy(BackoffSchedule schedule, Sleeper sleeper) {
        this.schedule = schedule;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new ScheduleContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        ScheduleContext context = (ScheduleContext) backOffContext;
        context.nextAttempt++;
        long delay = schedule.delayBefore(context.nextAttempt).toMillis();
        if (delay <= 0) {
            return;
        }
        log.trace("Backing off {} ms before attempt {}", delay, context.nextAttempt + 1);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while backing off", e);
        }
    }

    private static class ScheduleContext implements BackOffContext {
        private int nextAttempt;
    }
}
