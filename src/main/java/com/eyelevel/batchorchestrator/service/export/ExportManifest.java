package com.eyelevel.batchorchestrator.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of {@code manifest.json} inside an export archive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportManifest(
        @JsonProperty("exported_at") String exportedAt,
        int total,
        int exported,
        int failed,
        List<Entry> assets
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String filename,
            @JsonProperty("asset_type") String assetType,
            String fingerprint,
            String timestamp,
            @JsonProperty("tx_hash") String txHash,
            @JsonProperty("block_height") Long blockHeight,
            String path,
            String error
    ) {
    }
}
