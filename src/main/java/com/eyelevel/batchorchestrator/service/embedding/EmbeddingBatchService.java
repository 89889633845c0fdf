package com.eyelevel.batchorchestrator.service.embedding;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.EmbeddingStatus;
import com.eyelevel.batchorchestrator.model.EmbeddingWorkItem;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.service.policy.PlanPolicyResolver;
import com.eyelevel.batchorchestrator.service.policy.UserProfileService;
import com.eyelevel.batchorchestrator.service.progress.BatchRunState;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.scheduler.ConcurrencyLimitedScheduler;
import com.eyelevel.batchorchestrator.service.scheduler.ItemOutcome;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSession;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Batch fingerprint embedding of the files queued in a session. Concurrency comes from the user's
 * plan; embedding runs have no batch-size cap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingBatchService {

    private final BatchSessionStore batchSessionStore;
    private final ConcurrencyLimitedScheduler scheduler;
    private final RemoteOperationAdapter remoteOperationAdapter;
    private final PlanPolicyResolver planPolicyResolver;
    private final UserProfileService userProfileService;
    private final BatchProcessingConfig batchProcessingConfig;
    private final TaskScheduler taskScheduler;

    public List<EmbeddingWorkItem> enqueue(String sessionId, List<MediaFile> files) {
        BatchSession session = batchSessionStore.getOrCreate(sessionId);
        List<EmbeddingWorkItem> items = files.stream().map(EmbeddingWorkItem::new).toList();
        session.addEmbeddingItems(items);
        log.info("Session '{}' queued {} files for embedding", sessionId, items.size());
        return items;
    }

    public boolean remove(String sessionId, String itemId) {
        return batchSessionStore.get(sessionId).removeEmbeddingItem(itemId);
    }

    public List<EmbeddingWorkItem> list(String sessionId) {
        return List.copyOf(batchSessionStore.get(sessionId).getEmbeddingItems());
    }

    public int clearFinished(String sessionId) {
        return batchSessionStore.get(sessionId).clearFinishedEmbeddingItems();
    }

    /**
     * Replaces every failed item of the session by a new pending item for the same file.
     *
     * @return the new items.
     */
    public List<EmbeddingWorkItem> requeueFailed(String sessionId) {
        BatchSession session = batchSessionStore.get(sessionId);
        synchronized (session) {
            if (session.isRunning(BatchKind.EMBEDDING)) {
                return List.of();
            }
            List<EmbeddingWorkItem> failed = session.getEmbeddingItems().stream().filter(EmbeddingWorkItem::isFailed)
                                                    .toList();
            List<EmbeddingWorkItem> requeued = new ArrayList<>(failed.size());
            for (EmbeddingWorkItem item : failed) {
                if (item.getQuotaDeducted() == QuotaDeduction.DEDUCTED) {
                    log.warn("Requeueing '{}' although its failed attempt {} already consumed quota", item.getName(),
                             item.getId());
                }
                EmbeddingWorkItem copy = item.requeue();
                log.debug("Requeued failed item {} as {}", item.getId(), copy.getId());
                requeued.add(copy);
            }
            session.getEmbeddingItems().removeAll(failed);
            session.addEmbeddingItems(requeued);
            return requeued;
        }
    }

    /**
     * Starts embedding every pending item of the session and returns without waiting.
     *
     * @throws com.eyelevel.batchorchestrator.exception.BatchAlreadyRunningException if an embedding
     *                                                                               run is active.
     */
    public ActiveBatch start(String sessionId, Authentication auth, EmbeddingOptions options) {
        BatchSession session = batchSessionStore.getOrCreate(sessionId);
        PlanPolicy policy = planPolicyResolver.resolveForUser(auth);
        double strength = options.strength() == null ? batchProcessingConfig.getEmbedding().getDefaultStrength()
                                                     : options.strength();

        List<EmbeddingWorkItem> pending = session.getEmbeddingItems().stream()
                                                 .filter(item -> item.getStatus() == EmbeddingStatus.PENDING)
                                                 .toList();
        ActiveBatch batch = session.startBatch(BatchKind.EMBEDDING, pending);
        log.info("Session '{}' starting embedding of {} files on plan {} (concurrency {})", sessionId,
                 pending.size(), policy.plan().getValue(), policy.maxConcurrency());

        CompletableFuture<BatchSummary> completion =
                scheduler.submit(pending, policy.maxConcurrency(),
                                 item -> embedOne(auth, item, strength, options.authorName()),
                                 batch.getProgress(), batch.getCancellationToken())
                         .whenComplete((summary, error) -> {
                             if (summary != null && (summary.succeeded() > 0 || summary.state() == BatchRunState.HALTED)) {
                                 scheduleQuotaRefresh(session, auth);
                             }
                         });
        batch.attach(completion);
        return batch;
    }

    public boolean cancel(String sessionId) {
        return batchSessionStore.get(sessionId).getBatch(BatchKind.EMBEDDING).filter(batch -> !batch.isFinished())
                                .map(batch -> batch.getCancellationToken().cancel()).orElse(false);
    }

    ItemOutcome embedOne(Authentication auth, EmbeddingWorkItem item, double strength, String authorName) {
        item.transitionTo(EmbeddingStatus.UPLOADING);
        RemoteResult<EmbedResult> result = remoteOperationAdapter.embed(auth, item.getFile(), strength, authorName,
                                                                        item::markUploaded);
        if (result.isOk()) {
            item.complete(result.getValue());
            return ItemOutcome.SUCCEEDED;
        }
        item.fail(result.getCode(), result.getMessage(), result.getQuotaDeducted());
        if (result.isQuotaExhausted()) {
            log.warn("Quota exhausted while embedding '{}'; stopping the batch", item.getName());
            return ItemOutcome.HALT_BATCH;
        }
        log.warn("Embedding of '{}' failed: {} ({})", item.getName(), result.getCode(), result.getErrorKind());
        return ItemOutcome.FAILED;
    }

    /**
     * The server updates counters shortly after responding, so the quota is read again after a delay.
     */
    private void scheduleQuotaRefresh(BatchSession session, Authentication auth) {
        BatchProcessingConfig.QuotaRefresh refresh = batchProcessingConfig.getQuotaRefresh();
        if (!refresh.isEnabled()) {
            return;
        }
        for (Long delayMs : refresh.getDelaysMs()) {
            taskScheduler.schedule(() -> refreshQuota(session, auth), Instant.now().plusMillis(delayMs));
        }
    }

    void refreshQuota(BatchSession session, Authentication auth) {
        try {
            userProfileService.fetchProfile(auth).map(UserProfile::toQuotaSnapshot).ifPresent(snapshot -> {
                session.setQuotaSnapshot(snapshot);
                log.debug("Session '{}' quota now {}/{}", session.getId(), snapshot.quotaUsed(),
                          snapshot.quotaTotal());
            });
        } catch (RuntimeException e) {
            log.warn("Could not refresh the quota of session '{}': {}", session.getId(), e.getMessage());
        }
    }
}
