package com.eyelevel.batchorchestrator.exception.handler;

import com.eyelevel.batchorchestrator.dto.common.ApiResponse;
import com.eyelevel.batchorchestrator.exception.BatchAlreadyRunningException;
import com.eyelevel.batchorchestrator.exception.BatchNotFoundException;
import com.eyelevel.batchorchestrator.exception.BatchProcessingException;
import com.eyelevel.batchorchestrator.exception.GateTicketNotFoundException;
import com.eyelevel.batchorchestrator.exception.ItemNotRemovableException;
import com.eyelevel.batchorchestrator.exception.QuotaExhaustedException;
import com.eyelevel.batchorchestrator.exception.SessionNotFoundException;
import com.eyelevel.batchorchestrator.exception.apiclient.*;
import com.eyelevel.batchorchestrator.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles client-side errors related to business logic. (400 Bad Request)
     */
    @ExceptionHandler({BatchProcessingException.class,
            JsonParsingException.class,
            IllegalArgumentException.class,
            BadRequestException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed.");
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing required request parameters, parts and headers. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Required parameter is missing.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingRequestPart(MissingServletRequestPartException ex) {
        String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Required file is missing.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingRequestHeader(MissingRequestHeaderException ex) {
        String errorMessage = String.format("Required header '%s' is missing.", ex.getHeaderName());
        log.warn("Handling MissingRequestHeaderException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Required header is missing.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> String.format("'%s': %s",
                        violation.getPropertyPath().toString().substring(violation.getPropertyPath().toString().lastIndexOf('.') + 1),
                        violation.getMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Object>> handleHandlerMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getAllErrors().stream()
                .map(error -> Objects.toString(error.getDefaultMessage(), "invalid value"))
                .collect(Collectors.joining(", "));
        log.warn("Handling handler method validation exception: {}", errors);
        ApiResponse<Object> response = ApiResponse.error("Invalid input provided.", "Validation failed: " + errors);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters (e.g., string for a Long). (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Invalid parameter type provided.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles uploads over the configured multipart limits. (413 Payload Too Large)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("The uploaded files are too large.", ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    /**
     * Handles the remote API rejecting the caller's credentials. (401 Unauthorized)
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiResponse<Object>> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Unauthorized Access Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.UNAUTHORIZED);
    }

    /**
     * Handles an exhausted plan quota. The response carries the upgrade path. (402 Payment Required)
     */
    @ExceptionHandler(QuotaExhaustedException.class)
    public ResponseEntity<ApiResponse<Object>> handleQuotaExhausted(QuotaExhaustedException ex) {
        log.warn("Quota Exhausted Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.errorWithResponse(ex.getMessage(),
                Map.of("upgradePath", Objects.toString(ex.getUpgradePath(), "")));
        return new ResponseEntity<>(response, HttpStatus.PAYMENT_REQUIRED);
    }

    @ExceptionHandler(PaymentRequiredException.class)
    public ResponseEntity<ApiResponse<Object>> handlePaymentRequired(PaymentRequiredException ex) {
        log.warn("Payment Required Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.PAYMENT_REQUIRED);
    }

    /**
     * Handles forbidden access errors. (403 Forbidden)
     */
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiResponse<Object>> handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden Access Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.FORBIDDEN);
    }

    /**
     * Handles unknown sessions, batches and gate tickets. (404 Not Found)
     */
    @ExceptionHandler({SessionNotFoundException.class,
            BatchNotFoundException.class,
            GateTicketNotFoundException.class,
            NotFoundException.class})
    public ResponseEntity<ApiResponse<Object>> handleNotFound(RuntimeException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.NOT_FOUND);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = ex.getSupportedMethods() == null ? "" : String.join(", ", ex.getSupportedMethods());
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        ApiResponse<Object> response = ApiResponse.error("Method not allowed.", errorMessage);
        return new ResponseEntity<>(response, HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles a second run of a workflow that is already running, or removal of an item that is no longer pending. (409 Conflict)
     */
    @ExceptionHandler({BatchAlreadyRunningException.class,
            ItemNotRemovableException.class,
            ConflictException.class})
    public ResponseEntity<ApiResponse<Object>> handleConflict(RuntimeException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.CONFLICT);
    }

    /**
     * Handles rate-limiting errors. (429 Too Many Requests)
     */
    @ExceptionHandler(TooManyRequestsException.class)
    public ResponseEntity<ApiResponse<Object>> handleTooManyRequests(TooManyRequestsException ex) {
        log.warn("Too Many Requests Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.TOO_MANY_REQUESTS);
    }


    // --- 5xx Server Error Handlers ---

    /**
     * Handles bad gateway errors from the watermarking API. (502 Bad Gateway)
     */
    @ExceptionHandler(BadGatewayException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadGateway(BadGatewayException ex) {
        log.error("Bad Gateway Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.BAD_GATEWAY);
    }

    /**
     * Handles an unreachable watermarking API. (503 Service Unavailable)
     */
    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Service Unavailable Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles requests to the watermarking API that exceeded the timeout. (504 Gateway Timeout)
     */
    @ExceptionHandler(GatewayTimeoutException.class)
    public ResponseEntity<ApiResponse<Object>> handleGatewayTimeout(GatewayTimeoutException ex) {
        log.error("Gateway Timeout Exception: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        return new ResponseEntity<>(response, HttpStatus.GATEWAY_TIMEOUT);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     * This includes InternalServerException and any other RuntimeException.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        ApiResponse<Object> response = ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
