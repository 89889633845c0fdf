package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The watermarking API rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2214805317790431562L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
