package com.eyelevel.batchorchestrator.client.dto;

import com.eyelevel.batchorchestrator.model.PlanKey;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of {@code GET /users/me}. Only the fields that drive plan policy and quota display are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
        String id,
        String username,
        String role,

        @JsonProperty("display_name")
        String displayName,

        String plan,

        @JsonProperty("quota_used")
        Integer quotaUsed,

        @JsonProperty("quota_total")
        Integer quotaTotal,

        @JsonProperty("quota_embed_used")
        Integer quotaEmbedUsed,

        @JsonProperty("quota_embed_total")
        Integer quotaEmbedTotal,

        @JsonProperty("subscription_status")
        String subscriptionStatus
) {

    /**
     * Embedding quota when the profile carries the dedicated counters, otherwise the general one.
     */
    public int effectiveQuotaUsed() {
        return quotaEmbedUsed != null ? quotaEmbedUsed : quotaUsed == null ? 0 : quotaUsed;
    }

    public int effectiveQuotaTotal() {
        return quotaEmbedTotal != null ? quotaEmbedTotal : quotaTotal == null ? 0 : quotaTotal;
    }

    public QuotaSnapshot toQuotaSnapshot() {
        return new QuotaSnapshot(PlanKey.fromValue(plan), effectiveQuotaUsed(), effectiveQuotaTotal(), Instant.now());
    }
}
