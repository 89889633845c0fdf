package com.eyelevel.batchorchestrator.service.quota;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.eyelevel.batchorchestrator.service.policy.PlanPolicyResolver;
import com.eyelevel.batchorchestrator.service.policy.UserProfileService;
import com.eyelevel.batchorchestrator.service.session.BatchSession;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads the user's quota for display. A successful read is kept on the session so the last known
 * counters survive a failed refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaStatusService {

    private final BatchSessionStore batchSessionStore;
    private final UserProfileService userProfileService;
    private final PlanPolicyResolver planPolicyResolver;

    public QuotaStatus current(String sessionId, Authentication auth) {
        BatchSession session = batchSessionStore.getOrCreate(sessionId);
        QuotaSnapshot snapshot = userProfileService.fetchProfile(auth).map(UserProfile::toQuotaSnapshot)
                                                  .orElse(null);
        if (snapshot != null) {
            session.setQuotaSnapshot(snapshot);
        } else {
            snapshot = session.getQuotaSnapshot();
            log.debug("Profile unavailable for session '{}'; serving last known quota", sessionId);
        }
        PlanPolicy policy = snapshot == null ? planPolicyResolver.resolveForUser(auth)
                                             : planPolicyResolver.resolve(snapshot.plan());
        return new QuotaStatus(policy, snapshot);
    }

    /**
     * @param snapshot {@code null} if the quota has never been read successfully
     */
    public record QuotaStatus(PlanPolicy policy, QuotaSnapshot snapshot) {
    }
}
