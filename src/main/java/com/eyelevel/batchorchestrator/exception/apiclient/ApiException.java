package com.eyelevel.batchorchestrator.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures reported by, or while talking to, the remote watermarking API.
 *
 * <p>The status code is the HTTP status returned by the remote side, or the closest equivalent
 * for transport-level failures (503 for connection problems, 504 for timeouts). Business
 * rejections that arrive inside a 200 body are not exceptions; they are surfaced through
 * {@link com.eyelevel.batchorchestrator.client.result.RemoteResult}.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -1386540987760612044L;
    private final int statusCode;

    /**
     * @param message    A descriptive message, usually the raw response body.
     * @param statusCode The HTTP status code associated with the failure.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Whether the remote side answered at all. Transport failures never reached a handler, so
     * nothing can have been charged against the account.
     */
    public boolean isTransportFailure() {
        return false;
    }
}
