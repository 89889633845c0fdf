package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Media types accepted by the batch embedding workflow. Text is embedded one request at a time.
 */
@Getter
@AllArgsConstructor
public enum MediaKind {
    IMAGE("image"),
    VIDEO("video");

    private final String value;

    /**
     * Classifies an upload by its content type, falling back to the file extension.
     */
    public static MediaKind detect(String contentType, String fileName) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("video/")) {
            return VIDEO;
        }
        if (fileName != null) {
            String lower = fileName.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".mp4") || lower.endsWith(".mov") || lower.endsWith(".avi") || lower.endsWith(".mkv")
                || lower.endsWith(".webm")) {
                return VIDEO;
            }
        }
        return IMAGE;
    }
}
