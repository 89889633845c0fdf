package com.eyelevel.batchorchestrator.client.dto;

import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

/**
 * One row of the authoritative asset list returned by {@code GET /assets}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetDto(
        Long id,

        @JsonProperty("user_id")
        String userId,

        String filename,
        String fingerprint,
        String timestamp,
        Double psnr,

        @JsonProperty("output_path")
        String outputPath,

        @JsonProperty("author_name")
        String authorName,

        @JsonProperty("preview_url")
        String previewUrl,

        @JsonProperty("tx_hash")
        String txHash,

        @JsonProperty("block_height")
        Long blockHeight,

        @JsonProperty("asset_type")
        String assetType
) {

    public boolean isAnchored() {
        return StringUtils.hasText(txHash);
    }

    public AnchorReceipt toReceipt() {
        return new AnchorReceipt(txHash, blockHeight);
    }

    /**
     * @return the best URL to fetch the stored file from, {@code null} if the row has none.
     */
    public String downloadLocation() {
        return StringUtils.hasText(previewUrl) ? previewUrl : outputPath;
    }
}
