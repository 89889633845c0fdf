package com.eyelevel.batchorchestrator.service.policy;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.model.PlanKey;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps subscription plans to operational limits. The table is configuration; plans missing from it
 * keep the built-in limits, and anything unrecognized resolves to the free tier.
 */
@Slf4j
@Component
public class PlanPolicyResolver {

    private static final Map<PlanKey, PlanPolicy> BUILT_IN = Map.of(
            PlanKey.FREE, new PlanPolicy(PlanKey.FREE, 2, 10),
            PlanKey.PERSONAL, new PlanPolicy(PlanKey.PERSONAL, 3, 30),
            PlanKey.PRO, new PlanPolicy(PlanKey.PRO, 5, null),
            PlanKey.ENTERPRISE, new PlanPolicy(PlanKey.ENTERPRISE, 8, null));

    private final Map<PlanKey, PlanPolicy> policies;
    private final UserProfileService userProfileService;

    public PlanPolicyResolver(BatchProcessingConfig config, UserProfileService userProfileService) {
        this.userProfileService = userProfileService;
        Map<PlanKey, PlanPolicy> table = new EnumMap<>(BUILT_IN);
        config.getPlans().forEach((name, limits) -> {
            PlanKey key = PlanKey.fromValue(name);
            if (!key.getValue().equalsIgnoreCase(name.trim())) {
                log.warn("Ignoring limits for unrecognized plan '{}'", name);
                return;
            }
            try {
                table.put(key, new PlanPolicy(key, limits.getMaxConcurrency(), limits.getMaxBatchSize()));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid limits for plan '{}': {}", name, e.getMessage());
            }
        });
        this.policies = Collections.unmodifiableMap(table);
        log.info("Plan limits: {}", policies.values());
    }

    public PlanPolicy resolve(PlanKey planKey) {
        return policies.get(planKey == null ? PlanKey.FREE : planKey);
    }

    public PlanPolicy resolve(String rawPlan) {
        return resolve(PlanKey.fromValue(rawPlan));
    }

    /**
     * Resolves the limits of the signed-in user. If the profile cannot be read the free tier applies.
     */
    public PlanPolicy resolveForUser(Authentication auth) {
        PlanPolicy policy = userProfileService.fetchProfile(auth).map(UserProfile::plan).map(this::resolve)
                                              .orElseGet(() -> resolve(PlanKey.FREE));
        log.debug("Resolved plan policy {}", policy);
        return policy;
    }
}
