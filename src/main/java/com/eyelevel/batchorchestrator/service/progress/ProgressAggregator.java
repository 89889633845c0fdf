package com.eyelevel.batchorchestrator.service.progress;

import com.eyelevel.batchorchestrator.model.BatchKind;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single writer of a {@link BatchRun}. Each item completion is recorded exactly once; counters
 * only grow and {@code errors <= done <= total} holds at every snapshot.
 */
@Slf4j
public class ProgressAggregator {

    private final BatchRun run;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private BatchSummary summary;

    public ProgressAggregator(BatchKind kind, int total) {
        this.run = new BatchRun(kind, total);
    }

    public String getRunId() {
        return run.getId();
    }

    public BatchKind getKind() {
        return run.getKind();
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public synchronized void markCurrent(String name) {
        run.setCurrentName(name);
        publish();
    }

    public synchronized void recordSuccess() {
        checkCapacity();
        run.incrementDone();
        publish();
    }

    public synchronized void recordFailure() {
        checkCapacity();
        run.incrementDone();
        run.incrementErrors();
        publish();
    }

    /**
     * Closes the run. Calling it again returns the first summary.
     */
    public synchronized BatchSummary finish(BatchRunState finalState) {
        if (summary != null) {
            return summary;
        }
        if (!finalState.isFinished()) {
            throw new IllegalArgumentException("Not a final state: " + finalState);
        }
        run.finish(finalState);
        summary = new BatchSummary(run.getId(), run.getKind(), run.getTotal(), run.getDone() - run.getErrors(),
                                   run.getErrors(), run.elapsed(), finalState);
        log.info("{} batch {} finished ({}): {}, errors={}", run.getKind().getValue(), run.getId(),
                 finalState.getValue(), summary.describe(), summary.errors());
        listeners.forEach(listener -> {
            try {
                listener.onFinished(summary);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed on completion of batch {}", run.getId(), e);
            }
        });
        return summary;
    }

    public synchronized BatchProgress snapshot() {
        return new BatchProgress(run.getId(), run.getKind(), run.getDone(), run.getTotal(), run.getErrors(),
                                 run.getCurrentName(), run.getState(), run.elapsed().toMillis());
    }

    public synchronized BatchSummary getSummary() {
        return summary;
    }

    public synchronized boolean isFinished() {
        return summary != null;
    }

    private void checkCapacity() {
        if (summary != null) {
            throw new IllegalStateException("Batch " + run.getId() + " is already finished");
        }
        if (run.getDone() >= run.getTotal()) {
            throw new IllegalStateException("Batch " + run.getId() + " already recorded all " + run.getTotal()
                                            + " items");
        }
    }

    private void publish() {
        if (listeners.isEmpty()) {
            return;
        }
        BatchProgress progress = snapshot();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for batch {}", run.getId(), e);
            }
        }
    }
}
