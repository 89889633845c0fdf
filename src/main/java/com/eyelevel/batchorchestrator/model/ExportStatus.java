package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Lifecycle of one asset download inside an export batch.
 */
@Getter
@AllArgsConstructor
public enum ExportStatus implements ItemStatus<ExportStatus> {
    PENDING("pending"),
    DOWNLOADING("downloading"),
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
    public boolean canTransitionTo(ExportStatus next) {
        return switch (this) {
            case PENDING -> next == DOWNLOADING || next == ERROR;
            case DOWNLOADING -> next == DONE || next == ERROR;
            case DONE, ERROR -> false;
        };
    }
}
