package com.eyelevel.batchorchestrator.service.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.Serial;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Re-fetches authoritative remote state until it shows what an earlier call promised, or until the
 * {@link BackoffSchedule} runs out. Fetch failures count as an unconfirmed attempt; nothing is
 * thrown to the caller. An unconfirmed outcome leaves the decision of what to show to the caller,
 * which keeps its last optimistic state.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final BackoffSchedule defaultSchedule;
    private final Sleeper sleeper;
    private final RetryListener retryListener;

    public ReconciliationService(@Qualifier("reconciliationSchedule") BackoffSchedule defaultSchedule,
                                 @Qualifier("reconciliationSleeper") Sleeper sleeper,
                                 @Qualifier("reconciliationRetryListener") RetryListener retryListener) {
        this.defaultSchedule = defaultSchedule;
        this.sleeper = sleeper;
        this.retryListener = retryListener;
    }

    public BackoffSchedule getDefaultSchedule() {
        return defaultSchedule;
    }

    public <T> ReconcileOutcome<T> awaitConfirmation(String description, Supplier<T> fetch, Predicate<T> confirmed) {
        return awaitConfirmation(description, fetch, confirmed, defaultSchedule);
    }

    /**
     * Polls {@code fetch} until {@code confirmed} holds for its result.
     *
     * @param description names the polled resource in logs.
     */
    public <T> ReconcileOutcome<T> awaitConfirmation(String description, Supplier<T> fetch, Predicate<T> confirmed,
                                                     BackoffSchedule schedule) {
        AtomicReference<T> lastValue = new AtomicReference<>();
        AtomicInteger attempts = new AtomicInteger();
        RetryTemplate template = buildTemplate(schedule);

        try {
            return template.execute(context -> {
                context.setAttribute(RetryContext.NAME, description);
                if (context.getRetryCount() == 0) {
                    sleep(schedule.delayBefore(0).toMillis());
                }
                attempts.incrementAndGet();
                T value = fetch.get();
                lastValue.set(value);
                if (!confirmed.test(value)) {
                    throw new NotYetConfirmedException();
                }
                log.debug("'{}' confirmed on attempt {}", description, attempts.get());
                return new ReconcileOutcome<>(true, value, attempts.get());
            }, context -> new ReconcileOutcome<>(false, lastValue.get(), attempts.get()));
        } catch (BackOffInterruptedException e) {
            log.warn("Polling for '{}' was interrupted after {} attempts", description, attempts.get());
            return new ReconcileOutcome<>(false, lastValue.get(), attempts.get());
        }
    }

    private RetryTemplate buildTemplate(BackoffSchedule schedule) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(schedule.maxAttempts()));
        template.setBackOffPolicy(new ScheduleBackOffPolicy(schedule, sleeper));
        template.registerListener(retryListener);
        return template;
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            // the next back-off observes the flag and ends the polling
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Signals an attempt whose fetch succeeded but did not show the expected state yet.
     */
    static class NotYetConfirmedException extends RuntimeException {
        @Serial
        private static final long serialVersionUID = 5470232119736427164L;

        NotYetConfirmedException() {
            super("not yet confirmed", null, false, false);
        }
    }
}
