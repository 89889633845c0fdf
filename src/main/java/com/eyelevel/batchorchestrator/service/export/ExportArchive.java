package com.eyelevel.batchorchestrator.service.export;

import java.time.Instant;

/**
 * A finished export: the ZIP bytes and what went into them.
 */
public record ExportArchive(String fileName, byte[] content, int total, int exported, int failed,
                            Instant createdAt) {

    public long size() {
        return content.length;
    }
}
