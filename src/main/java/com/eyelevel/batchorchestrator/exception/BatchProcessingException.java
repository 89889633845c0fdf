package com.eyelevel.batchorchestrator.exception;

import java.io.Serial;

/**
 * Base exception for invalid requests against the batch workflows.
 */
public class BatchProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6021391180464407385L;

    public BatchProcessingException(String message) {
        super(message);
    }

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
