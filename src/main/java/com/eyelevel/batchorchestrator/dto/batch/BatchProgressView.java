package com.eyelevel.batchorchestrator.dto.batch;

import com.eyelevel.batchorchestrator.service.progress.BatchProgress;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Progress of a batch run with its items, polled by the front end.
 *
 * @param summary one-line outcome once the run has finished, e.g. {@code "8/10 succeeded in 12.4s"}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchProgressView(
        String runId,
        String kind,
        String state,
        int done,
        int total,
        int succeeded,
        int errors,
        int percent,
        String currentName,
        long elapsedMillis,
        String summary,
        List<WorkItemView> items
) {

    public static BatchProgressView from(ActiveBatch batch) {
        BatchProgress progress = batch.snapshot();
        BatchSummary summary = batch.isFinished() ? batch.getProgress().getSummary() : null;
        return new BatchProgressView(progress.runId(), progress.kind().getValue(), progress.state().getValue(),
                                     progress.done(), progress.total(), progress.succeeded(), progress.errors(),
                                     progress.percent(), progress.currentName(), progress.elapsedMillis(),
                                     summary == null ? null : summary.describe(),
                                     batch.getItems().stream().map(WorkItemView::from).toList());
    }
}
