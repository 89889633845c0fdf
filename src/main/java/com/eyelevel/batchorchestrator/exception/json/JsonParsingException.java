package com.eyelevel.batchorchestrator.exception.json;

import java.io.Serial;

/**
 * Thrown when a remote payload cannot be read, or a manifest cannot be written, as JSON.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2867203304716690514L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
