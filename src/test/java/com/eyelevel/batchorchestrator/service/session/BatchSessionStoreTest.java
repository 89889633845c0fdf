package com.eyelevel.batchorchestrator.service.session;

import com.eyelevel.batchorchestrator.exception.BatchAlreadyRunningException;
import com.eyelevel.batchorchestrator.exception.SessionNotFoundException;
import com.eyelevel.batchorchestrator.model.AnchoringWorkItem;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.EmbeddingWorkItem;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.service.progress.BatchRunState;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchSessionStoreTest {

    private final BatchSessionStore store = new BatchSessionStore();

    private static EmbeddingWorkItem pendingFile(String name) {
        return new EmbeddingWorkItem(new MediaFile(name, "image/png", new byte[]{1}, null));
    }

    @Test
    void sameIdReturnsTheSameSession() {
        BatchSession first = store.getOrCreate("abc");
        BatchSession second = store.getOrCreate(" abc ");

        assertThat(second).isSameAs(first);
        assertThat(store.get("abc")).isSameAs(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void unknownSessionIsReported() {
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void blankOrOversizedIdsAreRejected() {
        assertThatThrownBy(() -> store.getOrCreate(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.getOrCreate(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.getOrCreate("x".repeat(129))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyOneBatchPerKindRunsAtATime() {
        BatchSession session = store.getOrCreate("abc");
        ActiveBatch running = session.startBatch(BatchKind.ANCHORING, List.of(new AnchoringWorkItem(1L, "a.png")));

        assertThatThrownBy(() -> session.startBatch(BatchKind.ANCHORING, List.of()))
                .isInstanceOf(BatchAlreadyRunningException.class);
        assertThat(session.startBatch(BatchKind.EXPORT, List.of())).isNotNull();

        running.getProgress().finish(BatchRunState.COMPLETED);

        assertThat(session.isRunning(BatchKind.ANCHORING)).isFalse();
        assertThat(session.startBatch(BatchKind.ANCHORING, List.of())).isNotSameAs(running);
    }

    @Test
    void batchWithPendingFollowUpStillCountsAsRunning() {
        BatchSession session = store.getOrCreate("abc");
        ActiveBatch export = session.startBatch(BatchKind.EXPORT, List.of(new AnchoringWorkItem(1L, "a.png")));
        CompletableFuture<BatchSummary> completion = new CompletableFuture<>();
        export.attach(completion);

        BatchSummary summary = export.getProgress().finish(BatchRunState.COMPLETED);

        assertThat(export.isFinished()).isFalse();
        assertThat(export.snapshot().state()).isEqualTo(BatchRunState.RUNNING);
        assertThat(session.hasRunningBatch()).isTrue();
        assertThat(store.evictIdle(Instant.now().plusSeconds(60))).isZero();

        completion.complete(summary);

        assertThat(export.isFinished()).isTrue();
        assertThat(export.snapshot().state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(session.hasRunningBatch()).isFalse();
    }

    @Test
    void queuedItemsCannotBeRemovedWhileTheirBatchRuns() {
        BatchSession session = store.getOrCreate("abc");
        EmbeddingWorkItem item = pendingFile("a.png");
        session.addEmbeddingItems(List.of(item));
        ActiveBatch running = session.startBatch(BatchKind.EMBEDDING, List.of(item));

        assertThat(session.removeEmbeddingItem(item.getId())).isFalse();
        assertThat(session.clearFinishedEmbeddingItems()).isZero();

        running.getProgress().finish(BatchRunState.CANCELLED);

        assertThat(session.removeEmbeddingItem(item.getId())).isTrue();
        assertThat(session.getEmbeddingItems()).isEmpty();
    }

    @Test
    void idleSessionsAreEvictedUnlessABatchIsRunning() {
        store.getOrCreate("idle");
        BatchSession busy = store.getOrCreate("busy");
        busy.startBatch(BatchKind.EXPORT, List.of(new AnchoringWorkItem(2L, "b.png")));

        int evicted = store.evictIdle(Instant.now().plusSeconds(60));

        assertThat(evicted).isEqualTo(1);
        assertThat(store.get("busy")).isSameAs(busy);
        assertThatThrownBy(() -> store.get("idle")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void recentlyUsedSessionsSurviveEviction() {
        store.getOrCreate("fresh");

        assertThat(store.evictIdle(Instant.now().minusSeconds(3600))).isZero();
        assertThat(store.size()).isEqualTo(1);
    }
}
