package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * A proxy in front of the remote API returned an invalid upstream response (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5528870139976428813L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
