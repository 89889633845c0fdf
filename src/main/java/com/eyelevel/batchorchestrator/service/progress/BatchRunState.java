package com.eyelevel.batchorchestrator.service.progress;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum BatchRunState {
    RUNNING("running", false),
    COMPLETED("completed", true),
    /** Stopped by the user; queued items were marked cancelled. */
    CANCELLED("cancelled", true),
    /** Stopped after the remote side reported the quota as exhausted. */
    HALTED("halted", true);

    private final String value;
    private final boolean finished;
}
