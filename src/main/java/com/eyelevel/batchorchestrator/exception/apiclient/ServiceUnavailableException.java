package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The remote API could not be reached or is temporarily unavailable (HTTP 503).
 *
 * <p>Connection failures are mapped to this type as well, so callers treat them as transient.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 9001761235527401374L;

    private final boolean transportFailure;

    public ServiceUnavailableException(String message) {
        this(message, false);
    }

    public ServiceUnavailableException(String message, boolean transportFailure) {
        super(message, 503);
        this.transportFailure = transportFailure;
    }

    @Override
    public boolean isTransportFailure() {
        return transportFailure;
    }
}
