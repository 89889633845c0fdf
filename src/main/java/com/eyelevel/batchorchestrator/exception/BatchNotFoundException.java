package com.eyelevel.batchorchestrator.exception;

import com.eyelevel.batchorchestrator.model.BatchKind;

import java.io.Serial;

public class BatchNotFoundException extends BatchProcessingException {
    @Serial
    private static final long serialVersionUID = 6019288841745150327L;

    public BatchNotFoundException(String sessionId, BatchKind kind) {
        super(String.format("No %s batch has been started in session '%s'.", kind.getValue(), sessionId));
    }
}
