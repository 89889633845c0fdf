package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Per-item badge shown for anchoring: waiting for a confirmed transaction, confirmed, or failed.
 */
@Getter
@AllArgsConstructor
public enum AnchorBadge {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    FAILED("failed");

    private final String value;
}
