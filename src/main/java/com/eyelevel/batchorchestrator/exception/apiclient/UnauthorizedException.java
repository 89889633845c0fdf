package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The forwarded access token was missing, expired or rejected (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7090134458823260017L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
