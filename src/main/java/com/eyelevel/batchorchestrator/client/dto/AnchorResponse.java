package com.eyelevel.batchorchestrator.client.dto;

import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /anchor/{id}}. The hash may still be missing when the anchor was only
 * accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnchorResponse(
        Boolean success,
        String message,
        String error,

        @JsonProperty("tx_hash")
        String txHash,

        @JsonProperty("block_height")
        Long blockHeight
) {

    public boolean isRejected() {
        return Boolean.FALSE.equals(success);
    }

    public AnchorReceipt toReceipt() {
        return new AnchorReceipt(txHash, blockHeight);
    }
}
