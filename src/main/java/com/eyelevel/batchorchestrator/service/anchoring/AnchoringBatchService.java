package com.eyelevel.batchorchestrator.service.anchoring;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.exception.BatchAlreadyRunningException;
import com.eyelevel.batchorchestrator.exception.QuotaExhaustedException;
import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.eyelevel.batchorchestrator.model.AnchoringStatus;
import com.eyelevel.batchorchestrator.model.AnchoringWorkItem;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.service.policy.PlanPolicyResolver;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.quota.GateChoice;
import com.eyelevel.batchorchestrator.service.quota.GateDecision;
import com.eyelevel.batchorchestrator.service.quota.GateEvaluation;
import com.eyelevel.batchorchestrator.service.quota.GateTicket;
import com.eyelevel.batchorchestrator.service.quota.QuotaGate;
import com.eyelevel.batchorchestrator.service.reconcile.ReconcileOutcome;
import com.eyelevel.batchorchestrator.service.reconcile.ReconciliationService;
import com.eyelevel.batchorchestrator.service.scheduler.ConcurrencyLimitedScheduler;
import com.eyelevel.batchorchestrator.service.scheduler.ItemOutcome;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSession;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Blockchain anchoring of existing assets, one at a time or in bulk.
 *
 * <p>A bulk run works from a fresh authoritative asset list: every asset without a transaction hash
 * is pending, checked against the plan's batch-size cap, then anchored through the scheduler. When
 * the run ends the asset list is fetched again and applied to the items, so a confirmation that
 * arrived late still lands.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnchoringBatchService {

    private final BatchSessionStore batchSessionStore;
    private final ConcurrencyLimitedScheduler scheduler;
    private final RemoteOperationAdapter remoteOperationAdapter;
    private final WatermarkApiClient watermarkApiClient;
    private final PlanPolicyResolver planPolicyResolver;
    private final QuotaGate quotaGate;
    private final ReconciliationService reconciliationService;
    private final BatchProcessingConfig batchProcessingConfig;

    /**
     * Anchors one asset and waits, within the reconciliation schedule, for the transaction hash.
     *
     * @throws QuotaExhaustedException if the remote side reports the quota as spent.
     */
    public SingleAnchorOutcome anchorSingle(Authentication auth, long assetId) {
        long startedAt = System.currentTimeMillis();
        AnchoringWorkItem item = new AnchoringWorkItem(assetId, null);
        item.transitionTo(AnchoringStatus.ANCHORING);

        RemoteResult<AnchorReceipt> result = remoteOperationAdapter.anchor(auth, assetId);
        if (result.isQuotaExhausted()) {
            throw new QuotaExhaustedException(result.getMessage(), batchProcessingConfig.getUpgradePath());
        }
        int attempts = 0;
        if (!result.isOk()) {
            item.fail(result.getCode(), result.getMessage(), result.getQuotaDeducted());
        } else {
            item.applyOptimistic(result.getValue());
            if (!item.isConfirmed()) {
                attempts = awaitAnchor(auth, item);
            }
        }
        long elapsed = System.currentTimeMillis() - startedAt;
        log.info("Anchoring of asset {} ended as {} ({}) in {} ms", assetId, item.getStatus().getValue(),
                 item.badge(), elapsed);
        return SingleAnchorOutcome.of(item, attempts, elapsed);
    }

    /**
     * Fetches the asset list and either starts a bulk run or opens a gate ticket for the user.
     */
    public AnchorGateResult requestBulkAnchor(String sessionId, Authentication auth) {
        BatchSession session = batchSessionStore.getOrCreate(sessionId);
        if (session.isRunning(BatchKind.ANCHORING)) {
            throw new BatchAlreadyRunningException(sessionId, BatchKind.ANCHORING);
        }

        List<AssetDto> assets = watermarkApiClient.getAssets(auth);
        session.setAssets(assets);
        List<AssetDto> pending = pendingAssets(assets);
        PlanPolicy policy = planPolicyResolver.resolveForUser(auth);
        GateEvaluation<AssetDto> evaluation = quotaGate.evaluate(pending, policy);
        log.info("Session '{}' requested bulk anchoring: {} of {} assets pending, plan {} ({})", sessionId,
                 pending.size(), assets.size(), policy.plan().getValue(), evaluation.decision());

        return switch (evaluation.decision()) {
            case NOTHING_PENDING -> new AnchorGateResult(GateDecision.NOTHING_PENDING, 0, evaluation.limit(), 0, null,
                                                         "All assets are already anchored.", null, null);
            case PROCEED -> started(evaluation, launch(session, auth, policy, evaluation.pending()));
            case CONFIRMATION_REQUIRED -> {
                GateTicket<AssetDto> ticket = GateTicket.open(BatchKind.ANCHORING, evaluation);
                session.openGate(ticket);
                yield new AnchorGateResult(GateDecision.CONFIRMATION_REQUIRED, evaluation.pendingCount(),
                                           evaluation.limit(), evaluation.overflow(), ticket.id(),
                                           String.format("%d assets are pending but the plan allows %d per batch.",
                                                         evaluation.pendingCount(), evaluation.limit()),
                                           batchProcessingConfig.getUpgradePath(), null);
            }
        };
    }

    /**
     * Applies the user's answer to an open gate ticket.
     */
    public AnchorGateResult decide(String sessionId, Authentication auth, UUID ticketId, GateChoice choice) {
        BatchSession session = batchSessionStore.get(sessionId);
        GateTicket<AssetDto> ticket = session.takeGate(ticketId);
        GateEvaluation<AssetDto> evaluation = ticket.evaluation();
        List<AssetDto> selected = quotaGate.resolve(evaluation, choice);
        if (selected.isEmpty()) {
            String upgradePath = choice == GateChoice.UPGRADE ? batchProcessingConfig.getUpgradePath() : null;
            return new AnchorGateResult(evaluation.decision(), evaluation.pendingCount(), evaluation.limit(),
                                        evaluation.overflow(), ticketId,
                                        choice == GateChoice.UPGRADE ? "Upgrade the plan to anchor every asset."
                                                                     : "Bulk anchoring cancelled.",
                                        upgradePath, null);
        }
        try {
            return started(evaluation, launch(session, auth, evaluation.policy(), selected));
        } catch (BatchAlreadyRunningException e) {
            session.openGate(ticket);
            log.info("Session '{}' answered ticket {} while a run was active; the ticket stays open", sessionId,
                     ticketId);
            throw e;
        }
    }

    /**
     * Re-reads the asset list and applies it to the session's anchoring items.
     *
     * @return the number of items that changed.
     */
    public int refresh(String sessionId, Authentication auth) {
        BatchSession session = batchSessionStore.get(sessionId);
        List<AssetDto> assets = watermarkApiClient.getAssets(auth);
        return applyAuthoritative(session, assets);
    }

    public boolean cancel(String sessionId) {
        return batchSessionStore.get(sessionId).getBatch(BatchKind.ANCHORING).filter(batch -> !batch.isFinished())
                                .map(batch -> batch.getCancellationToken().cancel()).orElse(false);
    }

    /**
     * Assets without a transaction hash, in fetched order, each id at most once.
     */
    static List<AssetDto> pendingAssets(List<AssetDto> assets) {
        Set<Long> seen = new HashSet<>();
        List<AssetDto> pending = new ArrayList<>();
        for (AssetDto asset : assets) {
            if (asset.isAnchored()) {
                continue;
            }
            if (asset.id() == null || seen.add(asset.id())) {
                pending.add(asset);
            }
        }
        return pending;
    }

    private ActiveBatch launch(BatchSession session, Authentication auth, PlanPolicy policy,
                               List<AssetDto> selected) {
        List<AnchoringWorkItem> items = selected.stream().map(asset -> new AnchoringWorkItem(asset.id(),
                                                                                             asset.filename()))
                                                .toList();
        ActiveBatch batch = session.startBatch(BatchKind.ANCHORING, items);
        session.setAnchoringItems(items);

        CompletableFuture<BatchSummary> completion =
                scheduler.submit(items, policy.maxConcurrency(), item -> anchorOne(auth, item), batch.getProgress(),
                                 batch.getCancellationToken())
                         .thenApply(summary -> {
                             refreshAfterBatch(session, auth, items);
                             return summary;
                         });
        batch.attach(completion);
        return batch;
    }

    ItemOutcome anchorOne(Authentication auth, AnchoringWorkItem item) {
        if (item.getAssetId() == null) {
            item.fail(ErrorCode.MISSING_ASSET_ID, ErrorCode.MISSING_ASSET_ID.getSummary(), QuotaDeduction.NOT_DEDUCTED);
            return ItemOutcome.FAILED;
        }
        item.transitionTo(AnchoringStatus.ANCHORING);
        RemoteResult<AnchorReceipt> result = remoteOperationAdapter.anchor(auth, item.getAssetId());
        if (!result.isOk()) {
            item.fail(result.getCode(), result.getMessage(), result.getQuotaDeducted());
            return result.isQuotaExhausted() ? ItemOutcome.HALT_BATCH : ItemOutcome.FAILED;
        }
        item.applyOptimistic(result.getValue());
        if (!item.isConfirmed()) {
            awaitAnchor(auth, item);
        }
        return ItemOutcome.SUCCEEDED;
    }

    /**
     * Polls the asset list until the item's asset carries a transaction hash. Without confirmation the
     * item still ends anchored, shown as pending until a later refresh.
     *
     * @return the number of fetches made.
     */
    private int awaitAnchor(Authentication auth, AnchoringWorkItem item) {
        Long assetId = item.getAssetId();
        ReconcileOutcome<Optional<AssetDto>> outcome = reconciliationService.awaitConfirmation(
                "anchor of asset " + assetId,
                () -> watermarkApiClient.getAssets(auth).stream().filter(asset -> assetId.equals(asset.id()))
                                        .findFirst(),
                asset -> asset.isPresent() && asset.get().isAnchored());
        if (outcome.confirmed()) {
            item.applyOptimistic(outcome.lastValue().get().toReceipt());
        } else {
            item.settleUnconfirmed();
        }
        return outcome.attempts();
    }

    private void refreshAfterBatch(BatchSession session, Authentication auth, List<AnchoringWorkItem> items) {
        boolean awaiting = items.stream().anyMatch(item -> item.getStatus() == AnchoringStatus.ANCHORED
                                                           && !item.isConfirmed());
        if (!awaiting) {
            try {
                applyAuthoritative(session, watermarkApiClient.getAssets(auth));
            } catch (RuntimeException e) {
                log.warn("End-of-batch asset refresh for session '{}' failed: {}", session.getId(), e.getMessage());
            }
            return;
        }
        reconciliationService.awaitConfirmation("anchoring batch of session " + session.getId(), () -> {
            List<AssetDto> assets = watermarkApiClient.getAssets(auth);
            applyAuthoritative(session, assets);
            return assets;
        }, assets -> items.stream().noneMatch(item -> item.getStatus() == AnchoringStatus.ANCHORED
                                                      && !item.isConfirmed()));
    }

    private int applyAuthoritative(BatchSession session, List<AssetDto> assets) {
        session.setAssets(assets);
        Map<Long, AssetDto> byId = assets.stream().filter(asset -> asset.id() != null)
                                         .collect(Collectors.toMap(AssetDto::id, Function.identity(),
                                                                   (first, second) -> first));
        int changed = 0;
        for (AnchoringWorkItem item : session.getAnchoringItems()) {
            if (item.getAssetId() == null || !item.isTerminal()) {
                continue;
            }
            AssetDto asset = byId.get(item.getAssetId());
            if (asset != null && item.reconcile(asset.toReceipt())) {
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Reconciled {} anchoring items of session '{}'", changed, session.getId());
        }
        return changed;
    }

    private static AnchorGateResult started(GateEvaluation<AssetDto> evaluation, ActiveBatch batch) {
        return new AnchorGateResult(GateDecision.PROCEED, evaluation.pendingCount(), evaluation.limit(),
                                    evaluation.overflow(), null, null, null, batch);
    }
}
