package com.eyelevel.batchorchestrator.service.progress;

import com.eyelevel.batchorchestrator.model.BatchKind;

import java.time.Duration;
import java.util.Locale;

/**
 * Final report of a batch run, shown to the user when it ends.
 */
public record BatchSummary(String runId, BatchKind kind, int total, int succeeded, int errors, Duration elapsed,
                           BatchRunState state) {

    /**
     * @return e.g. {@code "8/10 succeeded in 12.4s"}.
     */
    public String describe() {
        return String.format(Locale.ROOT, "%d/%d succeeded in %.1fs", succeeded, total, elapsed.toMillis() / 1000.0);
    }
}
