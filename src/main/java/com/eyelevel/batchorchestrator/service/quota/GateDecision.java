package com.eyelevel.batchorchestrator.service.quota;

public enum GateDecision {
    /** Nothing to do; the user gets a notice instead of an error. */
    NOTHING_PENDING,
    /** The whole pending set fits the plan. */
    PROCEED,
    /** The pending set exceeds the plan's batch size and the user has to choose. */
    CONFIRMATION_REQUIRED
}
