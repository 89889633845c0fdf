package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Lifecycle of one file in a fingerprint-embedding batch.
 *
 * <pre>
 * PENDING -> UPLOADING -> PROCESSING -> DONE
 *                 \             \-> ERROR
 *                  \-> ERROR
 * </pre>
 * A queued item may also go straight from PENDING to ERROR when the batch is cancelled or halted
 * before a worker picks it up.
 */
@Getter
@AllArgsConstructor
public enum EmbeddingStatus implements ItemStatus<EmbeddingStatus> {
    PENDING("pending"),
    UPLOADING("uploading"),
    PROCESSING("processing"),
    DONE("done"),
    ERROR("error");

    private final String value;

    @Override
    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @Override
    public boolean isFailure() {
        return this == ERROR;
    }

    @Override
    public boolean canTransitionTo(EmbeddingStatus next) {
        return switch (this) {
            case PENDING -> next == UPLOADING || next == ERROR;
            case UPLOADING -> next == PROCESSING || next == ERROR;
            case PROCESSING -> next == DONE || next == ERROR;
            case DONE, ERROR -> false;
        };
    }
}
