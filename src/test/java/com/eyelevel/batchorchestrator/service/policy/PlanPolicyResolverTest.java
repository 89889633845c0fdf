package com.eyelevel.batchorchestrator.service.policy;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.model.PlanKey;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanPolicyResolverTest {

    @Mock
    private UserProfileService userProfileService;

    private final Authentication auth = new BearerTokenAuthentication("token");
    private BatchProcessingConfig config;

    @BeforeEach
    void setUp() {
        config = new BatchProcessingConfig();
    }

    private static UserProfile profileOnPlan(String plan) {
        return new UserProfile("u-1", "alice", "user", "Alice", plan, 3, 10, null, null, "active");
    }

    @Test
    void builtInTableAppliesWithoutConfiguration() {
        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        assertThat(resolver.resolve(PlanKey.FREE)).isEqualTo(new PlanPolicy(PlanKey.FREE, 2, 10));
        assertThat(resolver.resolve(PlanKey.PERSONAL)).isEqualTo(new PlanPolicy(PlanKey.PERSONAL, 3, 30));
        assertThat(resolver.resolve(PlanKey.PRO)).isEqualTo(new PlanPolicy(PlanKey.PRO, 5, null));
        assertThat(resolver.resolve(PlanKey.ENTERPRISE)).isEqualTo(new PlanPolicy(PlanKey.ENTERPRISE, 8, null));
    }

    @Test
    void unknownOrMissingPlanResolvesToFree() {
        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        assertThat(resolver.resolve("gold-tier").plan()).isEqualTo(PlanKey.FREE);
        assertThat(resolver.resolve((String) null).plan()).isEqualTo(PlanKey.FREE);
        assertThat(resolver.resolve("专业版").plan()).isEqualTo(PlanKey.PRO);
    }

    @Test
    void configuredLimitsOverrideTheBuiltInOnes() {
        BatchProcessingConfig.PlanLimits limits = new BatchProcessingConfig.PlanLimits();
        limits.setMaxConcurrency(4);
        limits.setMaxBatchSize(20);
        config.getPlans().put("free", limits);

        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        assertThat(resolver.resolve(PlanKey.FREE)).isEqualTo(new PlanPolicy(PlanKey.FREE, 4, 20));
        assertThat(resolver.resolve(PlanKey.PRO).maxConcurrency()).isEqualTo(5);
    }

    @Test
    void invalidOrUnrecognizedConfigurationIsIgnored() {
        BatchProcessingConfig.PlanLimits broken = new BatchProcessingConfig.PlanLimits();
        broken.setMaxConcurrency(0);
        config.getPlans().put("personal", broken);
        BatchProcessingConfig.PlanLimits unknown = new BatchProcessingConfig.PlanLimits();
        unknown.setMaxConcurrency(50);
        config.getPlans().put("platinum", unknown);

        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        assertThat(resolver.resolve(PlanKey.PERSONAL)).isEqualTo(new PlanPolicy(PlanKey.PERSONAL, 3, 30));
        assertThat(resolver.resolve(PlanKey.FREE)).isEqualTo(new PlanPolicy(PlanKey.FREE, 2, 10));
    }

    @Test
    void resolvesTheSignedInUsersPlan() {
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.of(profileOnPlan("Enterprise")));
        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        PlanPolicy policy = resolver.resolveForUser(auth);

        assertThat(policy.plan()).isEqualTo(PlanKey.ENTERPRISE);
        assertThat(policy.maxConcurrency()).isEqualTo(8);
        assertThat(policy.isBatchSizeBounded()).isFalse();
    }

    @Test
    void unreadableProfileFallsBackToFree() {
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.empty());
        PlanPolicyResolver resolver = new PlanPolicyResolver(config, userProfileService);

        assertThat(resolver.resolveForUser(auth)).isEqualTo(new PlanPolicy(PlanKey.FREE, 2, 10));
    }
}
