package com.eyelevel.batchorchestrator.model;

import lombok.Getter;

import java.util.Locale;

/**
 * One asset to download into an export archive.
 */
@Getter
public class ExportWorkItem extends WorkItem<ExportStatus> {

    private final Long assetId;
    private final String assetType;
    private final String previewUrl;
    private volatile long downloadedBytes;

    public ExportWorkItem(Long assetId, String fileName, String assetType, String previewUrl) {
        super(assetId == null ? "asset-" + fileName : "asset-" + assetId,
                fileName == null || fileName.isBlank() ? "asset_" + assetId : fileName, ExportStatus.PENDING);
        this.assetId = assetId;
        this.assetType = assetType == null || assetType.isBlank() ? "image" : assetType.toLowerCase(Locale.ROOT);
        this.previewUrl = previewUrl;
    }

    @Override
    protected ExportStatus errorStatus() {
        return ExportStatus.ERROR;
    }

    public synchronized void complete(long bytes) {
        transitionTo(ExportStatus.DONE);
        this.downloadedBytes = bytes;
    }
}
