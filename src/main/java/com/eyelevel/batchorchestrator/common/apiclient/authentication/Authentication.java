package com.eyelevel.batchorchestrator.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param authorization the request headers. Implementations add or replace their own entries.
     */
    void applyAuthentication(Map<String, String> authorization);
}
