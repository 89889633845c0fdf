package com.eyelevel.batchorchestrator.dto.anchoring;

import com.eyelevel.batchorchestrator.service.quota.GateChoice;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record GateDecisionRequest(
        @NotNull(message = "The 'ticketId' is required.") UUID ticketId,
        @NotNull(message = "The 'choice' is required.") GateChoice choice
) {
}
