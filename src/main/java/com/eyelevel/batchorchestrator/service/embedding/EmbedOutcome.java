package com.eyelevel.batchorchestrator.service.embedding;

import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;

import java.util.List;

/**
 * Result of a single embedding request.
 *
 * @param visibleInAssets whether the new fingerprint already shows up in the user's asset list
 * @param watermarkedText the marked text, for text embedding only
 */
public record EmbedOutcome(boolean success, EmbedResult result, String watermarkedText, boolean visibleInAssets,
                           String errorCode, String message, List<String> remediation,
                           QuotaDeduction quotaDeducted) {

    public static EmbedOutcome succeeded(EmbedResult result, String watermarkedText, boolean visibleInAssets) {
        return new EmbedOutcome(true, result, watermarkedText, visibleInAssets, null, result.message(), List.of(),
                                null);
    }

    public static EmbedOutcome failed(String errorCode, String message, QuotaDeduction quotaDeducted) {
        return new EmbedOutcome(false, null, null, false, errorCode, message,
                                ErrorCode.fromValue(errorCode).getRemediation(), quotaDeducted);
    }
}
