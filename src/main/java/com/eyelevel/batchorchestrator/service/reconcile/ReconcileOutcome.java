package com.eyelevel.batchorchestrator.service.reconcile;

/**
 * Result of polling for confirmation.
 *
 * @param confirmed whether the expected state was observed
 * @param lastValue the last successfully fetched value, {@code null} if every fetch failed
 * @param attempts  number of fetches made
 */
public record ReconcileOutcome<T>(boolean confirmed, T lastValue, int attempts) {
}
