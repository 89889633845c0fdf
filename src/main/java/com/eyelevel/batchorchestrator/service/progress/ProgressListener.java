package com.eyelevel.batchorchestrator.service.progress;

/**
 * Receives progress of a batch run. Callbacks run on worker threads, in the order the updates were
 * applied, and must not block.
 */
public interface ProgressListener {

    void onProgress(BatchProgress progress);

    default void onFinished(BatchSummary summary) {
    }
}
