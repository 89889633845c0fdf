package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The remote API, or the client-side request timeout, gave up waiting for a response (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3066184475211918170L;

    private final boolean transportFailure;

    public GatewayTimeoutException(String message) {
        this(message, false);
    }

    public GatewayTimeoutException(String message, boolean transportFailure) {
        super(message, 504);
        this.transportFailure = transportFailure;
    }

    @Override
    public boolean isTransportFailure() {
        return transportFailure;
    }
}
