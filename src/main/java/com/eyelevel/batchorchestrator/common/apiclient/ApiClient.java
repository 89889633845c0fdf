package com.eyelevel.batchorchestrator.common.apiclient;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.model.ApiRequest;
import com.eyelevel.batchorchestrator.common.apiclient.model.ApiResponse;
import com.eyelevel.batchorchestrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.batchorchestrator.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient}, the
 * default {@link Authentication}, the {@link HeaderConfig} and the per-request timeout.
 *
 * <p>Every call is bounded by the request timeout, independently of any retry or polling the
 * caller layers on top.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;
    protected final Duration requestTimeout;

    protected ApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                        Duration requestTimeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.authentication = authentication;
        this.headerConfig = headerConfig;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    /**
     * Executes an API call based on the provided {@link ApiRequest}.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response of a 2xx exchange.
     *
     * @throws ApiException If the remote side answered with an error status or could not be reached.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and target: {}", apiRequest.getMethod(), describeTarget(apiRequest));
        log.debug("ApiRequest details: {}", apiRequest);

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse).timeout(requestTimeout)
                                                     .onErrorMap(this::mapException).block();
            log.debug("Received apiResponse with status: {}", apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call to {} failed with status {}: {}", describeTarget(apiRequest), e.getStatusCode(),
                     e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call to {}", describeTarget(apiRequest), e);
            throw mapException(e);
        }
    }

    /**
     * Maps exceptions to the {@link ApiException} hierarchy based on the type of exception and, for
     * {@link WebClientResponseException}, the HTTP status code.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage(),
                                                   true);

        } else if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + requestTimeout.toMillis() + " ms", true);

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
    }

    /**
     * Sets the HTTP method and target. Absolute URIs are used as they are; paths are resolved
     * against the client's base URL with query parameters and path variables applied.
     */
    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        WebClient.RequestBodyUriSpec uriSpec = webClient.method(apiRequest.getMethod());
        if (apiRequest.getUri() != null) {
            return uriSpec.uri(apiRequest.getUri());
        }
        return uriSpec.uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Applies the request's own credentials (or the client default), the static headers from
     * {@link HeaderConfig} and the headers of the {@link ApiRequest}.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        Authentication effective = Optional.ofNullable(apiRequest.getAuthentication()).orElse(authentication);
        if (effective != null) {
            effective.applyAuthentication(apiRequest.getHeaders());
        }

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers -> headers.forEach(requestBodySpec::header));

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    /**
     * Configures the request body. Multipart bodies carry their own boundary, so no content type is
     * forced on them.
     */
    @SuppressWarnings("unchecked")
    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        try {
            if (apiRequest.getBody() instanceof MultiValueMap<?, ?> multipart) {
                requestBodySpec.body(BodyInserters.fromMultipartData((MultiValueMap<String, ?>) multipart));
                return;
            }
            MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
            requestBodySpec.contentType(contentType);
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return handleSuccessResponse(response, statusCode);
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return handleErrorResponse(response, statusCode);
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, int statusCode) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        MediaType acceptType = headers.getContentType();

        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder().data(data).acceptType(acceptType).headers(headers)
                                               .statusCode(statusCode).timestamp(timestamp).build())
                       .onErrorMap(error -> {
                           log.error("Error processing successful response body", error);
                           return new ApiException("Error processing response: " + error.getMessage(), statusCode);
                       });
    }

    private Mono<ApiResponse> handleErrorResponse(ClientResponse response, int statusCode) {
        return response.bodyToMono(String.class).defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates the {@link ApiException} matching an HTTP error status. 402 is kept distinct from
     * every other failure because it means the account's quota is spent.
     */
    private ApiException createException(String body, int statusCode) {
        log.debug("Creating exception for status code: {}, body: {}", statusCode, body);
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 402 -> new PaymentRequiredException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
    }

    private static String describeTarget(ApiRequest apiRequest) {
        return apiRequest.getUri() != null ? apiRequest.getUri().getPath() : apiRequest.getPath();
    }
}
