package com.eyelevel.batchorchestrator.service.anchoring;

import com.eyelevel.batchorchestrator.service.quota.GateDecision;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;

import java.util.UUID;

/**
 * What happened to a bulk anchor request: nothing to do, a started batch, or a pending decision.
 *
 * @param ticketId set when the user has to choose, see {@link GateDecision#CONFIRMATION_REQUIRED}
 * @param batch    set when a batch was started
 */
public record AnchorGateResult(GateDecision decision, int pendingCount, Integer limit, int overflow, UUID ticketId,
                               String notice, String upgradePath, ActiveBatch batch) {

    public boolean isStarted() {
        return batch != null;
    }
}
