package com.eyelevel.batchorchestrator.service.scheduler;

/**
 * The work performed for one item of a batch. Implementations move the item to a terminal status;
 * anything they throw is caught at the item boundary and recorded as a failure of that item only.
 *
 * @param <I> the work item type
 */
@FunctionalInterface
public interface ItemOperation<I> {

    ItemOutcome apply(I item) throws Exception;
}
