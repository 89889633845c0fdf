package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The caller is authenticated but not allowed to touch the resource (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5130882914662207741L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
