package com.eyelevel.batchorchestrator.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents a successful (2xx) response from the remote API.
 *
 * <p>A 2xx response is not necessarily a successful operation: the watermarking API reports
 * business rejections inside the body, so callers still have to inspect {@link #getData()}.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The response data as a byte array; empty when the server sent no body.
     */
    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    /**
     * The time the response was received.
     */
    private final Instant timestamp;
}
