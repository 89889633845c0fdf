package com.eyelevel.batchorchestrator.service.scheduler;

/**
 * What an {@link ItemOperation} reports back to the scheduler, besides the state it wrote on the item.
 */
public enum ItemOutcome {
    SUCCEEDED,
    FAILED,
    /**
     * The item failed in a way that forbids starting any further item of the batch, such as an
     * exhausted quota. Items already in flight still finish.
     */
    HALT_BATCH
}
