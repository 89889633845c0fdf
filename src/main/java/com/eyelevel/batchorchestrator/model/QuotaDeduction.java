package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Whether a failed attempt still consumed quota on the remote side. Retrying blindly is
 * discouraged when the answer is {@link #DEDUCTED}.
 */
@Getter
@AllArgsConstructor
public enum QuotaDeduction {
    DEDUCTED("deducted"),
    NOT_DEDUCTED("not_deducted"),
    UNKNOWN("unknown");

    private final String value;

    /**
     * Maps the optional {@code quota_deducted} flag of a remote response.
     */
    public static QuotaDeduction fromFlag(Boolean quotaDeducted) {
        if (quotaDeducted == null) {
            return UNKNOWN;
        }
        return quotaDeducted ? DEDUCTED : NOT_DEDUCTED;
    }
}
