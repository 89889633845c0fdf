package com.eyelevel.batchorchestrator.service.quota;

/**
 * The user's answer to a {@link GateDecision#CONFIRMATION_REQUIRED} evaluation.
 */
public enum GateChoice {
    CANCEL,
    /** Process the first {@code maxBatchSize} items in the order they were fetched. */
    PROCESS_CAPPED,
    /** Abandon and go to the plan upgrade page; nothing is processed. */
    UPGRADE,
    /** Explicit override: process everything despite the cap. */
    PROCESS_ALL
}
