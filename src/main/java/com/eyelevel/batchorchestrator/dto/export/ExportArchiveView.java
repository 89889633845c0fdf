package com.eyelevel.batchorchestrator.dto.export;

import com.eyelevel.batchorchestrator.service.export.ExportArchive;

import java.time.Instant;

public record ExportArchiveView(String fileName, long size, int total, int exported, int failed, Instant createdAt) {

    public static ExportArchiveView from(ExportArchive archive) {
        return new ExportArchiveView(archive.fileName(), archive.size(), archive.total(), archive.exported(),
                                     archive.failed(), archive.createdAt());
    }
}
