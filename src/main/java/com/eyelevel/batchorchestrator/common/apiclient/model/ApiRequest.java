package com.eyelevel.batchorchestrator.common.apiclient.model;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to the remote watermarking API.
 *
 * <p>Encapsulates the HTTP method, the target (either a path relative to the client's base URL or
 * an absolute {@link #uri}), query parameters, headers, body and the credentials of the user on
 * whose behalf the call is made.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * The HTTP method for the API request (e.g., GET, POST).
     */
    private final HttpMethod method;

    /**
     * The path (endpoint) of the API request, relative to the configured base URL.
     */
    @Nullable
    private final String path;

    /**
     * An absolute target, used instead of {@link #path} for server-issued links such as preview URLs.
     */
    @Nullable
    private final URI uri;

    /**
     * Optional query parameters to be included in the API request.
     */
    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Optional path variables to be expanded into {@link #path}.
     */
    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * The headers for the API request.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The body of the API request. A {@link org.springframework.util.MultiValueMap} is sent as
     * {@code multipart/form-data}; anything else is encoded with {@link #contentType}.
     */
    @Nullable
    private final Object body;

    /**
     * The media type that the client will accept in the response.
     */
    @Nullable
    private final MediaType acceptMediaType;

    /**
     * The content type of the request body. Defaults to JSON.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * Credentials of the end user. When absent the client's default authentication applies.
     */
    @Nullable
    private final Authentication authentication;
}
