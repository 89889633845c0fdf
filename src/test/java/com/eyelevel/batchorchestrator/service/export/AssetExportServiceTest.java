package com.eyelevel.batchorchestrator.service.export;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.client.result.RemoteResult.ErrorKind;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.ExportStatus;
import com.eyelevel.batchorchestrator.model.ExportWorkItem;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.scheduler.ConcurrencyLimitedScheduler;
import com.eyelevel.batchorchestrator.service.scheduler.ItemOutcome;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetExportServiceTest {

    private static final String SESSION = "session-x";

    @Mock
    private RemoteOperationAdapter remoteOperationAdapter;
    @Mock
    private WatermarkApiClient watermarkApiClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Authentication auth = new BearerTokenAuthentication("token");
    private final BatchSessionStore store = new BatchSessionStore();
    private ExecutorService executor;
    private AssetExportService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        service = new AssetExportService(store, new ConcurrencyLimitedScheduler(executor), remoteOperationAdapter,
                                         watermarkApiClient, new JacksonJsonSerializer(objectMapper),
                                         new BatchProcessingConfig());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static AssetDto asset(long id, String filename, String type, String previewUrl, String txHash) {
        return new AssetDto(id, "user-1", filename, "fp-" + id, "2026-01-02T03:04:05", 40.0, null, "alice",
                            previewUrl, txHash, txHash == null ? null : 900L, type);
    }

    private static Map<String, byte[]> unzip(byte[] archive) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), zip.readAllBytes());
            }
        }
        return entries;
    }

    @Test
    void exportGroupsFilesByTypeAndListsFailuresInTheManifest() throws IOException {
        when(watermarkApiClient.getAssets(auth)).thenReturn(List.of(
                asset(1, "a.png", "image", "/api/image/a.png", "0xa"),
                asset(2, "clip.mp4", "video", "/api/video/clip.mp4", null),
                asset(3, "a.png", "image", "/api/image/a-copy.png", null),
                asset(4, "note.txt", "text", null, null),
                asset(1, "a.png", "image", "/api/image/a.png", "0xa")));
        when(remoteOperationAdapter.download(eq(auth), eq("/api/image/a.png")))
                .thenReturn(RemoteResult.ok("first".getBytes(StandardCharsets.UTF_8)));
        when(remoteOperationAdapter.download(eq(auth), eq("/api/video/clip.mp4")))
                .thenReturn(RemoteResult.ok("video".getBytes(StandardCharsets.UTF_8)));
        when(remoteOperationAdapter.download(eq(auth), eq("/api/image/a-copy.png")))
                .thenReturn(RemoteResult.ok("second".getBytes(StandardCharsets.UTF_8)));

        ActiveBatch batch = service.startExport(SESSION, auth);
        BatchSummary summary = batch.getCompletion().orTimeout(10, TimeUnit.SECONDS).join();

        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.errors()).isEqualTo(1);
        ExportArchive archive = service.lastExport(SESSION).orElseThrow();
        assertThat(archive.fileName()).startsWith("copyright-assets-").endsWith(".zip");
        assertThat(archive.exported()).isEqualTo(3);
        assertThat(archive.failed()).isEqualTo(1);

        Map<String, byte[]> entries = unzip(archive.content());
        assertThat(entries.keySet()).containsExactlyInAnyOrder("images/a.png", "images/a_1.png", "videos/clip.mp4",
                                                               "manifest.json");
        assertThat(new String(entries.get("images/a.png"), StandardCharsets.UTF_8)).isEqualTo("first");
        assertThat(new String(entries.get("images/a_1.png"), StandardCharsets.UTF_8)).isEqualTo("second");

        JsonNode manifest = objectMapper.readTree(entries.get("manifest.json"));
        assertThat(manifest.get("total").asInt()).isEqualTo(4);
        assertThat(manifest.get("exported").asInt()).isEqualTo(3);
        assertThat(manifest.get("failed").asInt()).isEqualTo(1);
        assertThat(manifest.get("assets")).hasSize(4);
        JsonNode first = manifest.get("assets").get(0);
        assertThat(first.get("tx_hash").asText()).isEqualTo("0xa");
        assertThat(first.get("block_height").asLong()).isEqualTo(900L);
        JsonNode note = manifest.get("assets").get(3);
        assertThat(note.get("filename").asText()).isEqualTo("note.txt");
        assertThat(note.has("path")).isFalse();
        assertThat(note.get("error").asText()).isNotBlank();
    }

    @Test
    void archiveNameCarriesTheUtcTimestamp() {
        ExportWorkItem item = new ExportWorkItem(9L, "../evil/name.png", "image", "/x");
        item.transitionTo(ExportStatus.DOWNLOADING);
        item.complete(3);
        Map<String, byte[]> contents = new HashMap<>();
        contents.put(item.getId(), new byte[]{1, 2, 3});

        ExportArchive archive = service.buildArchive(List.of(item), Map.of(), contents,
                                                     Instant.parse("2026-03-04T05:06:07Z"));

        assertThat(archive.fileName()).isEqualTo("copyright-assets-20260304-050607.zip");
        assertThat(archive.exported()).isEqualTo(1);
    }

    @Test
    void unsafeNamesStayInsideTheirFolder() throws IOException {
        ExportWorkItem item = new ExportWorkItem(9L, "../evil/name.png", "image", "/x");
        item.transitionTo(ExportStatus.DOWNLOADING);
        item.complete(3);
        Map<String, byte[]> contents = new HashMap<>();
        contents.put(item.getId(), new byte[]{1, 2, 3});

        ExportArchive archive = service.buildArchive(List.of(item), Map.of(), contents, Instant.now());

        assertThat(unzip(archive.content()).keySet()).allSatisfy(name -> {
            assertThat(name).doesNotContain("..");
            assertThat(name.indexOf('/')).isEqualTo(name.lastIndexOf('/'));
        });
    }

    @Test
    void unknownTypesGoToTheOtherFolder() {
        assertThat(AssetExportService.folderFor("image")).isEqualTo("images/");
        assertThat(AssetExportService.folderFor("video")).isEqualTo("videos/");
        assertThat(AssetExportService.folderFor("text")).isEqualTo("texts/");
        assertThat(AssetExportService.folderFor("audio")).isEqualTo("other/");
        assertThat(AssetExportService.folderFor(null)).isEqualTo("other/");
    }

    @Test
    void quotaFailureDuringDownloadHaltsTheExport() {
        ExportWorkItem item = new ExportWorkItem(1L, "a.png", "image", "/api/image/a.png");
        when(remoteOperationAdapter.download(auth, "/api/image/a.png"))
                .thenReturn(RemoteResult.err(ErrorKind.QUOTA_EXHAUSTED, "QUOTA_EXHAUSTED", "quota spent",
                                             QuotaDeduction.NOT_DEDUCTED));

        ItemOutcome outcome = service.downloadOne(auth, item, new HashMap<>());

        assertThat(outcome).isEqualTo(ItemOutcome.HALT_BATCH);
        assertThat(item.getErrorCode()).isEqualTo(ErrorCode.DOWNLOAD_FAILED.getValue());
    }

    @Test
    void noExportYetGivesAnEmptyResult() {
        store.getOrCreate(SESSION);

        assertThat(service.lastExport(SESSION)).isEmpty();
    }
}
