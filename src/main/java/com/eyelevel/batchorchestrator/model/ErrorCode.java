package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stable taxonomy of work item failures. The first group mirrors the business codes returned by the
 * watermarking API in {@code {success:false, error:<code>}} bodies; the rest are produced locally.
 * Each code carries the user-facing summary and the remediation hints shown next to a failed item.
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {
    WATERMARK_EXISTS("WATERMARK_EXISTS", "The file already carries a fingerprint; it does not need to be embedded again.",
            List.of("The file already carries a fingerprint. Contact an administrator if it must be overwritten.")),
    INVALID_IMAGE("INVALID_IMAGE", "The image format could not be parsed.",
            List.of("The format may be unsupported; convert the file to JPG or PNG and retry.",
                    "The file may be corrupted; check that it opens normally.")),
    EMBED_FAILED("EMBED_FAILED", "Embedding failed while processing the file.",
            List.of("The resolution may be too low; use images of at least 256x256 pixels.",
                    "The server failed while processing; retry later.")),
    QUOTA_EXHAUSTED("QUOTA_EXHAUSTED", "The plan quota is exhausted.",
            List.of("Upgrade the plan to continue; the remaining files were not submitted and were not charged.")),
    NETWORK_ERROR("NETWORK_ERROR", "Network error, please retry.",
            List.of("Check that the network connection is stable.",
                    "Use JPG or PNG files no larger than 10MB.",
                    "If the failure persists retry later or contact support.")),
    REQUEST_REJECTED("REQUEST_REJECTED", "The request was rejected by the server.",
            List.of("Check that the session is still signed in and that the plan allows this operation.")),
    MISSING_ASSET_ID("MISSING_ASSET_ID", "The asset has no identifier and cannot be anchored.",
            List.of("Refresh the asset list and retry.")),
    ANCHOR_FAILED("ANCHOR_FAILED", "Anchoring on chain failed.",
            List.of("Retry later; the asset stays in the pending list until it is anchored.")),
    DOWNLOAD_FAILED("DOWNLOAD_FAILED", "The asset could not be downloaded.",
            List.of("The stored file may no longer be available; retry the export later.")),
    CANCELLED("CANCELLED", "The batch was cancelled before this item started.",
            List.of("Start a new batch to process the remaining items.")),
    UNKNOWN("UNKNOWN", "The operation failed.",
            List.of("Check that the network connection is stable.",
                    "If the failure persists retry later or contact support."));

    private static final Map<String, ErrorCode> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(ErrorCode::getValue, Function.identity()));

    private final String value;
    private final String summary;
    private final List<String> remediation;

    /**
     * Resolves a raw code from a remote body. Codes the client does not know are mapped to
     * {@link #UNKNOWN}; callers keep the raw code on the item so nothing is lost.
     */
    public static ErrorCode fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return UNKNOWN;
        }
        return VALUE_MAP.getOrDefault(value.trim(), UNKNOWN);
    }

    /**
     * Picks the message shown for a failed item: the known summary for a recognized code, otherwise
     * the server's own message, otherwise the generic fallback.
     */
    public static String describe(String rawCode, String serverMessage, String fallback) {
        ErrorCode code = fromValue(rawCode);
        if (code != UNKNOWN) {
            return code.getSummary();
        }
        return StringUtils.hasText(serverMessage) ? serverMessage : fallback;
    }
}
