package com.eyelevel.batchorchestrator.service.session;

import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.exception.BatchAlreadyRunningException;
import com.eyelevel.batchorchestrator.exception.GateTicketNotFoundException;
import com.eyelevel.batchorchestrator.model.AnchoringWorkItem;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.EmbeddingStatus;
import com.eyelevel.batchorchestrator.model.EmbeddingWorkItem;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.eyelevel.batchorchestrator.model.WorkItem;
import com.eyelevel.batchorchestrator.service.export.ExportArchive;
import com.eyelevel.batchorchestrator.service.quota.GateTicket;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Batch state of one client session, kept so that progress survives between requests.
 *
 * <p>While a batch runs, its items are written by the scheduler's workers only; everyone else reads
 * them. At most one batch per {@link BatchKind} is active at a time.
 */
@Getter
public class BatchSession {

    private final String id;
    private final Instant createdAt = Instant.now();
    private volatile Instant lastAccessedAt = createdAt;

    private final List<EmbeddingWorkItem> embeddingItems = new CopyOnWriteArrayList<>();
    private volatile List<AnchoringWorkItem> anchoringItems = List.of();
    private volatile List<AssetDto> assets = List.of();
    private final Map<BatchKind, ActiveBatch> batches = new EnumMap<>(BatchKind.class);
    private volatile GateTicket<AssetDto> gateTicket;

    @Setter
    private volatile ExportArchive lastExport;

    @Setter
    private volatile QuotaSnapshot quotaSnapshot;

    BatchSession(String id) {
        this.id = id;
    }

    public void touch() {
        lastAccessedAt = Instant.now();
    }

    public boolean isIdleSince(Instant threshold) {
        return lastAccessedAt.isBefore(threshold);
    }

    public Duration idleTime() {
        return Duration.between(lastAccessedAt, Instant.now());
    }

    /**
     * Registers a new run of {@code kind} over {@code items}.
     *
     * @throws BatchAlreadyRunningException if a run of the same kind has not finished yet.
     */
    public synchronized ActiveBatch startBatch(BatchKind kind, List<? extends WorkItem<?>> items) {
        ActiveBatch current = batches.get(kind);
        if (current != null && !current.isFinished()) {
            throw new BatchAlreadyRunningException(id, kind);
        }
        ActiveBatch batch = new ActiveBatch(kind, items);
        batches.put(kind, batch);
        touch();
        return batch;
    }

    /**
     * @return the running or most recently finished batch of {@code kind}.
     */
    public synchronized Optional<ActiveBatch> getBatch(BatchKind kind) {
        return Optional.ofNullable(batches.get(kind));
    }

    public synchronized boolean isRunning(BatchKind kind) {
        ActiveBatch batch = batches.get(kind);
        return batch != null && !batch.isFinished();
    }

    public synchronized boolean hasRunningBatch() {
        return batches.values().stream().anyMatch(batch -> !batch.isFinished());
    }

    public void addEmbeddingItems(Collection<EmbeddingWorkItem> items) {
        embeddingItems.addAll(items);
        touch();
    }

    /**
     * Removes a pending embedding item.
     *
     * @return {@code false} if no such item exists or it has already been picked up.
     */
    public synchronized boolean removeEmbeddingItem(String itemId) {
        if (isRunning(BatchKind.EMBEDDING)) {
            return false;
        }
        return embeddingItems.removeIf(item -> item.getId().equals(itemId)
                                               && item.getStatus() == EmbeddingStatus.PENDING);
    }

    /**
     * Drops finished embedding items, keeping pending ones.
     */
    public synchronized int clearFinishedEmbeddingItems() {
        if (isRunning(BatchKind.EMBEDDING)) {
            return 0;
        }
        List<EmbeddingWorkItem> finished = new ArrayList<>();
        embeddingItems.forEach(item -> {
            if (item.isTerminal()) {
                finished.add(item);
            }
        });
        embeddingItems.removeAll(finished);
        return finished.size();
    }

    public void setAnchoringItems(List<AnchoringWorkItem> items) {
        this.anchoringItems = List.copyOf(items);
    }

    public void setAssets(List<AssetDto> assets) {
        this.assets = List.copyOf(assets);
    }

    public synchronized void openGate(GateTicket<AssetDto> ticket) {
        this.gateTicket = ticket;
        touch();
    }

    /**
     * Removes and returns the open gate ticket with the given id.
     *
     * @throws GateTicketNotFoundException if the ticket is unknown or was already answered.
     */
    public synchronized GateTicket<AssetDto> takeGate(UUID ticketId) {
        GateTicket<AssetDto> ticket = gateTicket;
        if (ticket == null || !ticket.id().equals(ticketId)) {
            throw new GateTicketNotFoundException(ticketId);
        }
        gateTicket = null;
        return ticket;
    }
}
