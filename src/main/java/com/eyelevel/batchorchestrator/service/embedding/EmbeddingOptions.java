package com.eyelevel.batchorchestrator.service.embedding;

/**
 * Parameters shared by every file of an embedding run.
 *
 * @param strength   embedding strength, {@code null} for the configured default
 * @param authorName author recorded with the fingerprint
 */
public record EmbeddingOptions(Double strength, String authorName) {
}
