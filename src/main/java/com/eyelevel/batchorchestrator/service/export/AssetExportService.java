package com.eyelevel.batchorchestrator.service.export;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.json.JsonSerializer;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.exception.BatchProcessingException;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.ExportStatus;
import com.eyelevel.batchorchestrator.model.ExportWorkItem;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.scheduler.ConcurrencyLimitedScheduler;
import com.eyelevel.batchorchestrator.service.scheduler.ItemOutcome;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSession;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Downloads every asset of the user through the batch scheduler and packs them into one ZIP with a
 * folder per asset type and a {@code manifest.json}. Assets that fail to download are listed in the
 * manifest with their error and left out of the folders.
 */
@Slf4j
@Service
public class AssetExportService {

    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
                                                                            .withZone(ZoneOffset.UTC);
    private static final String MANIFEST = "manifest.json";

    private final BatchSessionStore batchSessionStore;
    private final ConcurrencyLimitedScheduler scheduler;
    private final RemoteOperationAdapter remoteOperationAdapter;
    private final WatermarkApiClient watermarkApiClient;
    private final JsonSerializer jsonSerializer;
    private final BatchProcessingConfig batchProcessingConfig;

    public AssetExportService(BatchSessionStore batchSessionStore, ConcurrencyLimitedScheduler scheduler,
                              RemoteOperationAdapter remoteOperationAdapter, WatermarkApiClient watermarkApiClient,
                              @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                              BatchProcessingConfig batchProcessingConfig) {
        this.batchSessionStore = batchSessionStore;
        this.scheduler = scheduler;
        this.remoteOperationAdapter = remoteOperationAdapter;
        this.watermarkApiClient = watermarkApiClient;
        this.jsonSerializer = jsonSerializer;
        this.batchProcessingConfig = batchProcessingConfig;
    }

    /**
     * Starts exporting all assets of the user. The archive is stored in the session when the run ends.
     */
    public ActiveBatch startExport(String sessionId, Authentication auth) {
        BatchSession session = batchSessionStore.getOrCreate(sessionId);
        List<AssetDto> assets = watermarkApiClient.getAssets(auth);
        session.setAssets(assets);

        Map<String, AssetDto> assetsByItem = new ConcurrentHashMap<>();
        List<ExportWorkItem> items = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (AssetDto asset : assets) {
            ExportWorkItem item = new ExportWorkItem(asset.id(), asset.filename(), asset.assetType(),
                                                     asset.downloadLocation());
            if (seen.add(item.getId())) {
                items.add(item);
                assetsByItem.put(item.getId(), asset);
            }
        }

        ActiveBatch batch = session.startBatch(BatchKind.EXPORT, items);
        Map<String, byte[]> contents = new ConcurrentHashMap<>();
        int concurrency = batchProcessingConfig.getExport().getConcurrency();
        log.info("Session '{}' exporting {} assets (concurrency {})", sessionId, items.size(), concurrency);

        CompletableFuture<BatchSummary> completion =
                scheduler.submit(items, concurrency, item -> downloadOne(auth, item, contents), batch.getProgress(),
                                 batch.getCancellationToken())
                         .thenApply(summary -> {
                             storeArchive(session, items, assetsByItem, contents);
                             return summary;
                         });
        batch.attach(completion);
        return batch;
    }

    public boolean cancel(String sessionId) {
        return batchSessionStore.get(sessionId).getBatch(BatchKind.EXPORT).filter(batch -> !batch.isFinished())
                                .map(batch -> batch.getCancellationToken().cancel()).orElse(false);
    }

    public Optional<ExportArchive> lastExport(String sessionId) {
        return Optional.ofNullable(batchSessionStore.get(sessionId).getLastExport());
    }

    ItemOutcome downloadOne(Authentication auth, ExportWorkItem item, Map<String, byte[]> contents) {
        item.transitionTo(ExportStatus.DOWNLOADING);
        if (!StringUtils.hasText(item.getPreviewUrl())) {
            item.fail(ErrorCode.DOWNLOAD_FAILED, "The asset has no stored file to download.",
                      QuotaDeduction.NOT_DEDUCTED);
            return ItemOutcome.FAILED;
        }
        RemoteResult<byte[]> result = remoteOperationAdapter.download(auth, item.getPreviewUrl());
        if (!result.isOk()) {
            item.fail(ErrorCode.DOWNLOAD_FAILED, result.getMessage(), result.getQuotaDeducted());
            return result.isQuotaExhausted() ? ItemOutcome.HALT_BATCH : ItemOutcome.FAILED;
        }
        byte[] content = result.getValue();
        contents.put(item.getId(), content);
        item.complete(content.length);
        return ItemOutcome.SUCCEEDED;
    }

    private void storeArchive(BatchSession session, List<ExportWorkItem> items, Map<String, AssetDto> assets,
                              Map<String, byte[]> contents) {
        try {
            ExportArchive archive = buildArchive(items, assets, contents, Instant.now());
            session.setLastExport(archive);
            log.info("Export for session '{}' ready: {} ({} of {} assets, {} bytes)", session.getId(),
                     archive.fileName(), archive.exported(), archive.total(), archive.size());
        } catch (BatchProcessingException e) {
            log.error("Could not build the export archive for session '{}'", session.getId(), e);
        }
    }

    ExportArchive buildArchive(List<ExportWorkItem> items, Map<String, AssetDto> assets,
                               Map<String, byte[]> contents, Instant now) {
        List<ExportManifest.Entry> entries = new ArrayList<>(items.size());
        Set<String> usedPaths = new HashSet<>();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exported = 0;

        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            for (ExportWorkItem item : items) {
                AssetDto asset = assets.get(item.getId());
                byte[] content = contents.get(item.getId());
                String path = null;
                if (item.getStatus() == ExportStatus.DONE && content != null) {
                    path = uniquePath(folderFor(item.getAssetType()) + sanitize(item.getName()), usedPaths);
                    zip.putNextEntry(new ZipEntry(path));
                    zip.write(content);
                    zip.closeEntry();
                    exported++;
                }
                entries.add(new ExportManifest.Entry(item.getName(), item.getAssetType(),
                                                     asset == null ? null : asset.fingerprint(),
                                                     asset == null ? null : asset.timestamp(),
                                                     asset == null ? null : asset.txHash(),
                                                     asset == null ? null : asset.blockHeight(), path,
                                                     item.isFailed() ? item.getError() : null));
            }
            ExportManifest manifest = new ExportManifest(now.toString(), items.size(), exported,
                                                         items.size() - exported, entries);
            zip.putNextEntry(new ZipEntry(MANIFEST));
            zip.write(jsonSerializer.serialize(manifest, true).getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException e) {
            throw new BatchProcessingException("Failed to write the export archive", e);
        }

        String fileName = batchProcessingConfig.getExport().getArchivePrefix() + "-" + ARCHIVE_STAMP.format(now)
                          + ".zip";
        return new ExportArchive(fileName, buffer.toByteArray(), items.size(), exported, items.size() - exported, now);
    }

    static String folderFor(String assetType) {
        return switch (assetType == null ? "" : assetType) {
            case "image" -> "images/";
            case "video" -> "videos/";
            case "text" -> "texts/";
            default -> "other/";
        };
    }

    private static String sanitize(String name) {
        String cleaned = name.replace('\\', '_').replace('/', '_').replace("..", "_").trim();
        return cleaned.isEmpty() ? "asset" : cleaned;
    }

    private static String uniquePath(String path, Set<String> usedPaths) {
        if (usedPaths.add(path)) {
            return path;
        }
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        String base = dot > slash ? path.substring(0, dot) : path;
        String extension = dot > slash ? path.substring(dot) : "";
        int counter = 1;
        String candidate;
        do {
            candidate = base + "_" + counter++ + extension;
        } while (!usedPaths.add(candidate));
        return candidate;
    }
}
