package com.eyelevel.batchorchestrator.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Raised for a single (non-batch) operation when the remote API answers HTTP 402. The caller must
 * not retry; the response carries an upgrade hint instead.
 */
@Getter
public class QuotaExhaustedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4806279513391016402L;

    private final String upgradePath;

    public QuotaExhaustedException(String message, String upgradePath) {
        super(message);
        this.upgradePath = upgradePath;
    }
}
