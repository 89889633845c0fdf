package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The remote state conflicts with the request, e.g. an asset that is already anchored (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7725519470301246230L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
