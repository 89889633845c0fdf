package com.eyelevel.batchorchestrator.service.progress;

import com.eyelevel.batchorchestrator.model.BatchKind;

/**
 * Immutable view of a batch run at one instant.
 *
 * @param currentName label of an item in flight; under concurrency the last writer wins
 */
public record BatchProgress(String runId, BatchKind kind, int done, int total, int errors, String currentName,
                            BatchRunState state, long elapsedMillis) {

    public int succeeded() {
        return done - errors;
    }

    public int percent() {
        return total == 0 ? 100 : (int) Math.floor(done * 100.0 / total);
    }
}
