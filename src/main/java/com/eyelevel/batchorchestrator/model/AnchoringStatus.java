package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Lifecycle of one asset in a bulk blockchain-anchoring batch.
 *
 * <pre>
 * PENDING -> ANCHORING -> ANCHORED
 *                 \-> ERROR
 * </pre>
 */
@Getter
@AllArgsConstructor
public enum AnchoringStatus implements ItemStatus<AnchoringStatus> {
    PENDING("pending"),
    ANCHORING("anchoring"),
    ANCHORED("anchored"),
    ERROR("error");

    private final String value;

    @Override
    public boolean isTerminal() {
        return this == ANCHORED || this == ERROR;
    }

    @Override
    public boolean isFailure() {
        return this == ERROR;
    }

    @Override
    public boolean canTransitionTo(AnchoringStatus next) {
        return switch (this) {
            case PENDING -> next == ANCHORING || next == ERROR;
            case ANCHORING -> next == ANCHORED || next == ERROR;
            case ANCHORED, ERROR -> false;
        };
    }
}
