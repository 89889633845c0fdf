package com.eyelevel.batchorchestrator.service.progress;

import com.eyelevel.batchorchestrator.model.BatchKind;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Counters of one batch run. Only {@link ProgressAggregator} writes them, under its own lock; readers
 * go through {@link ProgressAggregator#snapshot()}.
 */
@Getter
public class BatchRun {

    private final String id = UUID.randomUUID().toString();
    private final BatchKind kind;
    private final int total;
    private final Instant startedAt = Instant.now();
    private int done;
    private int errors;
    private String currentName;
    private BatchRunState state = BatchRunState.RUNNING;
    private Instant finishedAt;

    BatchRun(BatchKind kind, int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative, got " + total);
        }
        this.kind = kind;
        this.total = total;
    }

    void incrementDone() {
        done++;
    }

    void incrementErrors() {
        errors++;
    }

    void setCurrentName(String currentName) {
        this.currentName = currentName;
    }

    void finish(BatchRunState finalState) {
        this.state = finalState;
        this.finishedAt = Instant.now();
    }

    public boolean isComplete() {
        return done == total;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt == null ? Instant.now() : finishedAt);
    }
}
