package com.eyelevel.batchorchestrator.exception;

import java.io.Serial;

public class SessionNotFoundException extends BatchProcessingException {
    @Serial
    private static final long serialVersionUID = -2472839541052208719L;

    public SessionNotFoundException(String sessionId) {
        super("No batch session found for id '" + sessionId + "'.");
    }
}
