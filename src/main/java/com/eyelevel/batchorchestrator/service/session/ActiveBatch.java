package com.eyelevel.batchorchestrator.service.session;

import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.WorkItem;
import com.eyelevel.batchorchestrator.service.progress.BatchProgress;
import com.eyelevel.batchorchestrator.service.progress.BatchRunState;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.progress.ProgressAggregator;
import com.eyelevel.batchorchestrator.service.scheduler.CancellationToken;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A batch run registered in a session: its items, progress, cancellation flag and completion.
 */
@Getter
public class ActiveBatch {

    private final BatchKind kind;
    private final List<? extends WorkItem<?>> items;
    private final ProgressAggregator progress;
    private final CancellationToken cancellationToken = new CancellationToken();
    private volatile CompletableFuture<BatchSummary> completion;

    ActiveBatch(BatchKind kind, List<? extends WorkItem<?>> items) {
        this.kind = kind;
        this.items = List.copyOf(items);
        this.progress = new ProgressAggregator(kind, items.size());
    }

    public void attach(CompletableFuture<BatchSummary> completion) {
        this.completion = completion;
    }

    /**
     * A run is finished once its completion is done, which includes the follow-up step after the last
     * item (end-of-batch reconciliation, archive assembly).
     */
    public boolean isFinished() {
        CompletableFuture<BatchSummary> current = completion;
        return current != null ? current.isDone() : progress.isFinished();
    }

    /**
     * Progress as shown to the client. While the follow-up step runs the counters are final but the
     * run still reports {@link BatchRunState#RUNNING}.
     */
    public BatchProgress snapshot() {
        BatchProgress snapshot = progress.snapshot();
        if (snapshot.state().isFinished() && !isFinished()) {
            return new BatchProgress(snapshot.runId(), snapshot.kind(), snapshot.done(), snapshot.total(),
                                     snapshot.errors(), snapshot.currentName(), BatchRunState.RUNNING,
                                     snapshot.elapsedMillis());
        }
        return snapshot;
    }
}
