package com.eyelevel.batchorchestrator.dto.quota;

import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * The user's plan limits together with the last known quota counters.
 *
 * @param maxBatchSize {@code null} when bulk runs are unbounded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuotaView(
        String plan,
        int maxConcurrency,
        Integer maxBatchSize,
        Integer quotaUsed,
        Integer quotaTotal,
        Integer remaining,
        Instant fetchedAt
) {

    public static QuotaView of(PlanPolicy policy, QuotaSnapshot snapshot) {
        if (snapshot == null) {
            return new QuotaView(policy.plan().getValue(), policy.maxConcurrency(), policy.maxBatchSize(), null, null,
                                 null, null);
        }
        return new QuotaView(policy.plan().getValue(), policy.maxConcurrency(), policy.maxBatchSize(),
                             snapshot.quotaUsed(), snapshot.quotaTotal(), snapshot.remaining(), snapshot.fetchedAt());
    }
}
