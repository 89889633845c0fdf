package com.eyelevel.batchorchestrator.model;

import java.time.Instant;

/**
 * Last known quota of the signed-in account, as reported by the profile endpoint.
 */
public record QuotaSnapshot(PlanKey plan, int quotaUsed, int quotaTotal, Instant fetchedAt) {

    public int remaining() {
        return Math.max(quotaTotal - quotaUsed, 0);
    }
}
