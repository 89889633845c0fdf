package com.eyelevel.batchorchestrator.client.dto;

import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the image, text and video embedding endpoints. A 200 response with
 * {@code success=false} is a business rejection identified by {@link #error()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbedResponse(
        Boolean success,

        @JsonAlias("fingerprint_embedded")
        String fingerprint,

        Double psnr,

        @JsonProperty("download_url")
        String downloadUrl,

        @JsonProperty("asset_id")
        Long assetId,

        @JsonProperty("watermarked_text")
        String watermarkedText,

        String error,

        @JsonProperty("quota_deducted")
        Boolean quotaDeducted,

        @JsonProperty("quota_used")
        Integer quotaUsed,

        @JsonProperty("quota_total")
        Integer quotaTotal,

        @JsonProperty("processing_time_sec")
        Double processingTimeSec,

        String message
) {

    /**
     * The video endpoint omits the flag on success, so only an explicit {@code false} counts as a
     * rejection.
     */
    public boolean isRejected() {
        return Boolean.FALSE.equals(success);
    }

    public EmbedResult toResult() {
        return new EmbedResult(fingerprint, psnr, downloadUrl, assetId, message, processingTimeSec);
    }
}
