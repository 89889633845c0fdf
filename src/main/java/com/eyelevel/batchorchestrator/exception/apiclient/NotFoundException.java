package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The requested asset or endpoint does not exist on the remote side (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3348021965122817408L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
