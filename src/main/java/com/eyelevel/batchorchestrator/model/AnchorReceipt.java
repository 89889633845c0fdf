package com.eyelevel.batchorchestrator.model;

import org.springframework.util.StringUtils;

/**
 * What the chain (or the server on its behalf) has confirmed for an asset.
 *
 * @param txHash      transaction hash, {@code null} while the anchor is accepted but not final
 * @param blockHeight block height, may be {@code null}
 */
public record AnchorReceipt(String txHash, Long blockHeight) {

    public boolean isConfirmed() {
        return StringUtils.hasText(txHash);
    }
}
