package com.eyelevel.batchorchestrator.exception;

import com.eyelevel.batchorchestrator.model.BatchKind;

import java.io.Serial;

/**
 * A session may run at most one batch per workflow at a time.
 */
public class BatchAlreadyRunningException extends BatchProcessingException {
    @Serial
    private static final long serialVersionUID = 3312093415532286602L;

    public BatchAlreadyRunningException(String sessionId, BatchKind kind) {
        super(String.format("A %s batch is already running for session '%s'.", kind.getValue(), sessionId));
    }
}
