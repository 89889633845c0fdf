package com.eyelevel.batchorchestrator.service.policy;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.exception.apiclient.ApiException;
import com.eyelevel.batchorchestrator.exception.apiclient.BadGatewayException;
import com.eyelevel.batchorchestrator.exception.apiclient.ForbiddenException;
import com.eyelevel.batchorchestrator.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.batchorchestrator.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.batchorchestrator.exception.apiclient.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads the signed-in user's profile. Transient failures are retried; if the profile stays
 * unavailable the caller receives an empty result and falls back to conservative limits.
 * Authentication failures are not recovered.
 *
 * <p>Retry and recovery are applied by the Spring proxy, so callers must go through the bean.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private final WatermarkApiClient watermarkApiClient;

    @Retryable(
            retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class, BadGatewayException.class},
            noRetryFor = {UnauthorizedException.class, ForbiddenException.class},
            notRecoverable = {UnauthorizedException.class, ForbiddenException.class},
            maxAttemptsExpression = "#{${app.watermark-api.profile-retry.attempts}}",
            backoff = @Backoff(delayExpression = "#{${app.watermark-api.profile-retry.delay-ms}}"),
            listeners = {"profileRetryListener"}
    )
    public Optional<UserProfile> fetchProfile(Authentication auth) {
        return Optional.ofNullable(watermarkApiClient.me(auth));
    }

    @Recover
    public Optional<UserProfile> recoverFromApiException(ApiException e, Authentication auth) {
        log.warn("User profile unavailable (status {}); continuing without it.", e.getStatusCode());
        return Optional.empty();
    }
}
