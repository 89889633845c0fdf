package com.eyelevel.batchorchestrator.model;

/**
 * Operational limits of a plan.
 *
 * @param plan           the tier these limits belong to
 * @param maxConcurrency maximum number of remote operations in flight for one batch
 * @param maxBatchSize   maximum number of items a bulk anchor may process, {@code null} when unbounded
 */
public record PlanPolicy(PlanKey plan, int maxConcurrency, Integer maxBatchSize) {

    public PlanPolicy {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        if (maxBatchSize != null && maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive or unbounded, got " + maxBatchSize);
        }
    }

    public boolean isBatchSizeBounded() {
        return maxBatchSize != null;
    }

    /**
     * @return {@code true} if {@code count} items would go over the batch-size cap.
     */
    public boolean exceedsBatchSize(int count) {
        return isBatchSizeBounded() && count > maxBatchSize;
    }
}
