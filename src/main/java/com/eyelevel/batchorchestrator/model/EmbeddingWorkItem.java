package com.eyelevel.batchorchestrator.model;

import lombok.Getter;

import java.util.UUID;

/**
 * A file queued for fingerprint embedding. Ids are client-generated and never reused: a failed
 * file is retried by {@link #requeue() re-enqueueing} it as a brand-new item.
 */
@Getter
public class EmbeddingWorkItem extends WorkItem<EmbeddingStatus> {

    private final MediaFile file;
    private volatile EmbedResult result;

    public EmbeddingWorkItem(MediaFile file) {
        this(UUID.randomUUID().toString(), file);
    }

    EmbeddingWorkItem(String id, MediaFile file) {
        super(id, file.fileName(), EmbeddingStatus.PENDING);
        this.file = file;
    }

    @Override
    protected EmbeddingStatus errorStatus() {
        return EmbeddingStatus.ERROR;
    }

    /**
     * Called once the request body has been fully handed to the transport. No-op unless the item is
     * still uploading, since the transport callback may race with a fast response.
     */
    public synchronized void markUploaded() {
        if (getStatus() == EmbeddingStatus.UPLOADING) {
            transitionTo(EmbeddingStatus.PROCESSING);
        }
    }

    /**
     * Records a successful embed. An item whose upload callback never fired still passes through
     * {@code PROCESSING} so its own transitions stay ordered.
     */
    public synchronized void complete(EmbedResult embedResult) {
        markUploaded();
        transitionTo(EmbeddingStatus.DONE);
        this.result = embedResult;
    }

    /**
     * @return a new pending item for the same file, with a fresh id.
     */
    public EmbeddingWorkItem requeue() {
        return new EmbeddingWorkItem(file);
    }
}
