package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The remote API failed while handling the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6619250284471839501L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
