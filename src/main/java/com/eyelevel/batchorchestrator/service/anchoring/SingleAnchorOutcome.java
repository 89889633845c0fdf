package com.eyelevel.batchorchestrator.service.anchoring;

import com.eyelevel.batchorchestrator.model.AnchorBadge;
import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.eyelevel.batchorchestrator.model.AnchoringWorkItem;

/**
 * Result of anchoring one asset outside of a batch.
 *
 * @param attempts number of authoritative fetches made while waiting for confirmation
 */
public record SingleAnchorOutcome(Long assetId, String status, AnchorBadge badge, String txHash, Long blockHeight,
                                  String errorCode, String message, int attempts, long elapsedMillis) {

    static SingleAnchorOutcome of(AnchoringWorkItem item, int attempts, long elapsedMillis) {
        AnchorReceipt receipt = item.getReceipt();
        return new SingleAnchorOutcome(item.getAssetId(), item.getStatus().getValue(), item.badge(),
                                       receipt == null ? null : receipt.txHash(),
                                       receipt == null ? null : receipt.blockHeight(), item.getErrorCode(),
                                       item.getError(), attempts, elapsedMillis);
    }
}
