package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The remote API is throttling this account (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1480954266702334987L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
