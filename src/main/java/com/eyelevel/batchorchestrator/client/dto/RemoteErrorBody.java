package com.eyelevel.batchorchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body of a non-2xx response. The API puts its message in {@code detail}; some endpoints
 * use {@code message} or an {@code error} code instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteErrorBody(Object detail, String message, String error) {

    public String bestMessage() {
        if (detail instanceof String text && !text.isBlank()) {
            return text;
        }
        return message;
    }
}
