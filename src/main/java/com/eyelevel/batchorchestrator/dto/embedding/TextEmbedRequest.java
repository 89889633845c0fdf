package com.eyelevel.batchorchestrator.dto.embedding;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TextEmbedRequest(
        @NotBlank(message = "The 'text' cannot be empty.") @Size(max = 100_000) String text,
        String authorName
) {
}
