package com.eyelevel.batchorchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /embed/text}.
 */
public record TextEmbedPayload(String text, @JsonProperty("author_name") String authorName) {
}
