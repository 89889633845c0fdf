package com.eyelevel.batchorchestrator.dto.anchoring;

import com.eyelevel.batchorchestrator.dto.batch.BatchProgressView;
import com.eyelevel.batchorchestrator.service.anchoring.AnchorGateResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Answer to a bulk anchor request or gate decision.
 *
 * @param ticketId present when the user has to choose how to proceed
 * @param batch    present when a run was started
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnchorGateResponse(
        String decision,
        int pendingCount,
        Integer limit,
        int overflow,
        UUID ticketId,
        String notice,
        String upgradePath,
        BatchProgressView batch
) {

    public static AnchorGateResponse from(AnchorGateResult result) {
        return new AnchorGateResponse(result.decision().name(), result.pendingCount(), result.limit(),
                                      result.overflow(), result.ticketId(), result.notice(), result.upgradePath(),
                                      result.isStarted() ? BatchProgressView.from(result.batch()) : null);
    }
}
