package com.eyelevel.batchorchestrator.service.quota;

import com.eyelevel.batchorchestrator.model.BatchKind;

import java.time.Instant;
import java.util.UUID;

/**
 * A gate evaluation waiting for the user's choice.
 */
public record GateTicket<T>(UUID id, BatchKind kind, GateEvaluation<T> evaluation, Instant createdAt) {

    public static <T> GateTicket<T> open(BatchKind kind, GateEvaluation<T> evaluation) {
        return new GateTicket<>(UUID.randomUUID(), kind, evaluation, Instant.now());
    }
}
