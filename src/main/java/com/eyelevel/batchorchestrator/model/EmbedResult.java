package com.eyelevel.batchorchestrator.model;

/**
 * Success payload of an embedding item.
 */
public record EmbedResult(String fingerprint, Double psnr, String downloadUrl, Long assetId, String message,
                          Double processingTimeSec) {
}
