package com.eyelevel.batchorchestrator.service.quota;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.model.PlanKey;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.eyelevel.batchorchestrator.service.policy.PlanPolicyResolver;
import com.eyelevel.batchorchestrator.service.policy.UserProfileService;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuotaStatusServiceTest {

    private static final String SESSION = "quota-session";

    @Mock
    private UserProfileService userProfileService;

    @Mock
    private PlanPolicyResolver planPolicyResolver;

    private final Authentication auth = new BearerTokenAuthentication("user-token");
    private BatchSessionStore store;
    private QuotaStatusService service;

    @BeforeEach
    void setUp() {
        store = new BatchSessionStore();
        service = new QuotaStatusService(store, userProfileService, planPolicyResolver);
    }

    @Test
    void freshProfileIsStoredOnTheSession() {
        UserProfile profile = new UserProfile("u-1", "alice", "user", "Alice", "free", 4, 10, null, null, "active");
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.of(profile));
        when(planPolicyResolver.resolve(PlanKey.FREE)).thenReturn(new PlanPolicy(PlanKey.FREE, 2, 10));

        QuotaStatusService.QuotaStatus status = service.current(SESSION, auth);

        assertThat(status.snapshot().quotaUsed()).isEqualTo(4);
        assertThat(status.snapshot().remaining()).isEqualTo(6);
        assertThat(status.policy().maxBatchSize()).isEqualTo(10);
        assertThat(store.getOrCreate(SESSION).getQuotaSnapshot()).isEqualTo(status.snapshot());
    }

    @Test
    void unavailableProfileFallsBackToTheLastKnownSnapshot() {
        QuotaSnapshot lastKnown = new QuotaSnapshot(PlanKey.PRO, 40, 500, Instant.now());
        store.getOrCreate(SESSION).setQuotaSnapshot(lastKnown);
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.empty());
        when(planPolicyResolver.resolve(PlanKey.PRO)).thenReturn(new PlanPolicy(PlanKey.PRO, 5, null));

        QuotaStatusService.QuotaStatus status = service.current(SESSION, auth);

        assertThat(status.snapshot()).isEqualTo(lastKnown);
        assertThat(status.policy().plan()).isEqualTo(PlanKey.PRO);
    }

    @Test
    void neverReadQuotaUsesThePolicyOfTheUser() {
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.empty());
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.FREE, 2, 10));

        QuotaStatusService.QuotaStatus status = service.current(SESSION, auth);

        assertThat(status.snapshot()).isNull();
        assertThat(status.policy().plan()).isEqualTo(PlanKey.FREE);
    }
}
