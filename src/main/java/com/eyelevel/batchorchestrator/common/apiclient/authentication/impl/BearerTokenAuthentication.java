package com.eyelevel.batchorchestrator.common.apiclient.authentication.impl;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Forwards a user's bearer token to the remote API. The token is accepted with or without the
 * {@code Bearer } prefix, since it usually arrives straight from an incoming {@code Authorization}
 * header.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    private static final String PREFIX = "Bearer ";

    public static BearerTokenAuthentication fromHeader(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) {
            return new BearerTokenAuthentication(null);
        }
        String trimmed = authorizationHeader.trim();
        if (trimmed.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            trimmed = trimmed.substring(PREFIX.length()).trim();
        }
        return new BearerTokenAuthentication(trimmed);
    }

    public boolean isPresent() {
        return StringUtils.hasText(token);
    }

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying bearer token authentication.");
            return;
        }
        if (!isPresent()) {
            log.debug("No bearer token available; sending the request unauthenticated.");
            return;
        }
        try {
            authorization.put(HttpHeaders.AUTHORIZATION, PREFIX + token);
        } catch (UnsupportedOperationException e) {
            log.error("Cannot apply bearer token authentication. The provided authorization map is immutable.", e);
        }
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication{present=" + isPresent() + "}";
    }
}
