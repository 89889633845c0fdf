package com.eyelevel.batchorchestrator.service.reconcile;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The polling schedule used to wait for remote state to settle: the delay before each attempt.
 * The number of delays is the attempt limit.
 */
public record BackoffSchedule(List<Duration> delays) {

    private static final BackoffSchedule DEFAULT = ofMillis(List.of(0L, 300L, 800L, 1500L, 2500L));

    public BackoffSchedule {
        Objects.requireNonNull(delays, "delays must not be null");
        if (delays.isEmpty()) {
            throw new IllegalArgumentException("A backoff schedule needs at least one attempt");
        }
        if (delays.stream().anyMatch(delay -> delay == null || delay.isNegative())) {
            throw new IllegalArgumentException("Backoff delays must be non-negative: " + delays);
        }
        delays = List.copyOf(delays);
    }

    public static BackoffSchedule defaults() {
        return DEFAULT;
    }

    /**
     * @param delaysMs   delays in milliseconds.
     * @param maxAttempts caps the schedule; values above the number of delays repeat the last one.
     */
    public static BackoffSchedule ofMillis(List<Long> delaysMs, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        List<Duration> delays = delaysMs.stream().map(Duration::ofMillis).collect(Collectors.toList());
        if (delays.isEmpty()) {
            delays.add(Duration.ZERO);
        }
        while (delays.size() < maxAttempts) {
            delays.add(delays.get(delays.size() - 1));
        }
        return new BackoffSchedule(delays.subList(0, maxAttempts));
    }

    public static BackoffSchedule ofMillis(List<Long> delaysMs) {
        return ofMillis(delaysMs, Math.max(delaysMs.size(), 1));
    }

    /**
     * A schedule that polls {@code attempts} times without waiting.
     */
    public static BackoffSchedule zeroDelay(int attempts) {
        return new BackoffSchedule(Collections.nCopies(attempts, Duration.ZERO));
    }

    public int maxAttempts() {
        return delays.size();
    }

    /**
     * @param attempt zero-based attempt index.
     */
    public Duration delayBefore(int attempt) {
        return delays.get(Math.min(attempt, delays.size() - 1));
    }
}
