package com.eyelevel.batchorchestrator.model;

import java.util.Objects;

/**
 * A user-selected file held in memory until a worker uploads it.
 *
 * @param fileName    original file name
 * @param contentType declared MIME type, may be {@code null}
 * @param content     raw bytes
 * @param kind        image or video
 */
public record MediaFile(String fileName, String contentType, byte[] content, MediaKind kind) {

    public MediaFile {
        Objects.requireNonNull(content, "content must not be null");
        fileName = fileName == null || fileName.isBlank() ? "upload" : fileName;
        kind = kind == null ? MediaKind.detect(contentType, fileName) : kind;
    }

    public long size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "MediaFile{fileName='" + fileName + "', contentType='" + contentType + "', size=" + content.length
               + ", kind=" + kind + "}";
    }
}
