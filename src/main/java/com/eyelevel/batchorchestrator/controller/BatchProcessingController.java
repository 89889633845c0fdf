package com.eyelevel.batchorchestrator.controller;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.dto.anchoring.AnchorGateResponse;
import com.eyelevel.batchorchestrator.dto.anchoring.GateDecisionRequest;
import com.eyelevel.batchorchestrator.dto.batch.BatchProgressView;
import com.eyelevel.batchorchestrator.dto.batch.WorkItemView;
import com.eyelevel.batchorchestrator.dto.common.ApiResponse;
import com.eyelevel.batchorchestrator.dto.export.ExportArchiveView;
import com.eyelevel.batchorchestrator.dto.quota.QuotaView;
import com.eyelevel.batchorchestrator.exception.BatchNotFoundException;
import com.eyelevel.batchorchestrator.exception.ItemNotRemovableException;
import com.eyelevel.batchorchestrator.model.BatchKind;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.service.anchoring.AnchorGateResult;
import com.eyelevel.batchorchestrator.service.anchoring.AnchoringBatchService;
import com.eyelevel.batchorchestrator.service.embedding.EmbeddingBatchService;
import com.eyelevel.batchorchestrator.service.embedding.EmbeddingOptions;
import com.eyelevel.batchorchestrator.service.export.AssetExportService;
import com.eyelevel.batchorchestrator.service.export.ExportArchive;
import com.eyelevel.batchorchestrator.service.quota.QuotaStatusService;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST controller for session-scoped batch runs: embedding, bulk anchoring and asset export.
 * Every batch belongs to the session named by the {@code X-Session-Id} header.
 * All JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/batches")
@RequiredArgsConstructor
@Validated
public class BatchProcessingController implements BatchProcessingApi {

    private static final String SESSION_HEADER = "X-Session-Id";

    private final EmbeddingBatchService embeddingBatchService;
    private final AnchoringBatchService anchoringBatchService;
    private final AssetExportService assetExportService;
    private final QuotaStatusService quotaStatusService;
    private final BatchSessionStore batchSessionStore;

    // --- 1. EMBEDDING ENDPOINTS ---

    @Override
    @PostMapping(value = "/v1/embedding/items", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<List<WorkItemView>>> enqueueFiles(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestParam("files") final List<MultipartFile> files) {

        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required.");
        }
        log.info("Queueing {} files for embedding in session '{}'", files.size(), sessionId);
        List<MediaFile> mediaFiles = files.stream().map(RequestAuthentication::toMediaFile).toList();
        List<WorkItemView> queued = embeddingBatchService.enqueue(sessionId, mediaFiles).stream()
                                                         .map(WorkItemView::from).toList();

        return ResponseEntity.ok(ApiResponse.success(queued, String.format("%d files queued for embedding.",
                                                                           queued.size()), HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/embedding/items")
    public ResponseEntity<ApiResponse<List<WorkItemView>>> listEmbeddingItems(
            @RequestHeader(SESSION_HEADER) final String sessionId) {

        List<WorkItemView> items = embeddingBatchService.list(sessionId).stream().map(WorkItemView::from).toList();
        return ResponseEntity.ok(ApiResponse.success(items, "Embedding items retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @DeleteMapping("/v1/embedding/items/{itemId}")
    public ResponseEntity<ApiResponse<Void>> removeEmbeddingItem(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @PathVariable final String itemId) {

        if (!embeddingBatchService.remove(sessionId, itemId)) {
            throw new ItemNotRemovableException(itemId);
        }
        log.debug("Removed embedding item '{}' from session '{}'", itemId, sessionId);
        return ResponseEntity.ok(ApiResponse.success(null, "Item removed.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/embedding/items/clear-finished")
    public ResponseEntity<ApiResponse<Integer>> clearFinishedEmbeddingItems(
            @RequestHeader(SESSION_HEADER) final String sessionId) {

        int cleared = embeddingBatchService.clearFinished(sessionId);
        return ResponseEntity.ok(ApiResponse.success(cleared, String.format("%d finished items cleared.", cleared),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/embedding/requeue")
    public ResponseEntity<ApiResponse<List<WorkItemView>>> requeueFailed(
            @RequestHeader(SESSION_HEADER) final String sessionId) {

        List<WorkItemView> requeued = embeddingBatchService.requeueFailed(sessionId).stream()
                                                           .map(WorkItemView::from).toList();
        log.info("Requeued {} failed items in session '{}'", requeued.size(), sessionId);
        return ResponseEntity.ok(ApiResponse.success(requeued, String.format("%d failed items requeued.",
                                                                             requeued.size()), HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/embedding/start")
    public ResponseEntity<ApiResponse<BatchProgressView>> startEmbedding(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization,
            @RequestParam(value = "strength", required = false) final Double strength,
            @RequestParam(value = "authorName", required = false) final String authorName) {

        Authentication auth = RequestAuthentication.fromHeader(authorization);
        ActiveBatch batch = embeddingBatchService.start(sessionId, auth, new EmbeddingOptions(strength, authorName));
        return accepted(batch, "Embedding batch started.");
    }

    @Override
    @PostMapping("/v1/embedding/cancel")
    public ResponseEntity<ApiResponse<Boolean>> cancelEmbedding(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return cancelled(embeddingBatchService.cancel(sessionId), BatchKind.EMBEDDING);
    }

    @Override
    @GetMapping("/v1/embedding/progress")
    public ResponseEntity<ApiResponse<BatchProgressView>> embeddingProgress(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return progress(sessionId, BatchKind.EMBEDDING);
    }

    // --- 2. ANCHORING ENDPOINTS ---

    @Override
    @PostMapping("/v1/anchoring/request")
    public ResponseEntity<ApiResponse<AnchorGateResponse>> requestBulkAnchor(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization) {

        AnchorGateResult result = anchoringBatchService.requestBulkAnchor(sessionId,
                                                                          RequestAuthentication.fromHeader(authorization));
        return gateResponse(result);
    }

    @Override
    @PostMapping("/v1/anchoring/decision")
    public ResponseEntity<ApiResponse<AnchorGateResponse>> decideBulkAnchor(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization,
            @RequestBody final GateDecisionRequest request) {

        log.info("Session '{}' answered gate ticket {} with {}", sessionId, request.ticketId(), request.choice());
        AnchorGateResult result = anchoringBatchService.decide(sessionId, RequestAuthentication.fromHeader(authorization),
                                                               request.ticketId(), request.choice());
        return gateResponse(result);
    }

    @Override
    @PostMapping("/v1/anchoring/refresh")
    public ResponseEntity<ApiResponse<Integer>> refreshAnchoring(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization) {

        int changed = anchoringBatchService.refresh(sessionId, RequestAuthentication.fromHeader(authorization));
        return ResponseEntity.ok(ApiResponse.success(changed, String.format("%d items updated.", changed),
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/anchoring/cancel")
    public ResponseEntity<ApiResponse<Boolean>> cancelAnchoring(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return cancelled(anchoringBatchService.cancel(sessionId), BatchKind.ANCHORING);
    }

    @Override
    @GetMapping("/v1/anchoring/progress")
    public ResponseEntity<ApiResponse<BatchProgressView>> anchoringProgress(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return progress(sessionId, BatchKind.ANCHORING);
    }

    // --- 3. EXPORT ENDPOINTS ---

    @Override
    @PostMapping("/v1/export/start")
    public ResponseEntity<ApiResponse<BatchProgressView>> startExport(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization) {

        ActiveBatch batch = assetExportService.startExport(sessionId, RequestAuthentication.fromHeader(authorization));
        return accepted(batch, "Asset export started.");
    }

    @Override
    @PostMapping("/v1/export/cancel")
    public ResponseEntity<ApiResponse<Boolean>> cancelExport(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return cancelled(assetExportService.cancel(sessionId), BatchKind.EXPORT);
    }

    @Override
    @GetMapping("/v1/export/progress")
    public ResponseEntity<ApiResponse<BatchProgressView>> exportProgress(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        return progress(sessionId, BatchKind.EXPORT);
    }

    @Override
    @GetMapping(value = "/v1/export/archive", produces = "application/zip")
    public ResponseEntity<byte[]> downloadExport(@RequestHeader(SESSION_HEADER) final String sessionId) {
        ExportArchive archive = assetExportService.lastExport(sessionId)
                                                  .orElseThrow(() -> new BatchNotFoundException(sessionId,
                                                                                                BatchKind.EXPORT));
        log.info("Serving export archive '{}' ({} bytes) to session '{}'", archive.fileName(), archive.size(),
                 sessionId);
        return ResponseEntity.ok()
                             .contentType(MediaType.parseMediaType("application/zip"))
                             .header(HttpHeaders.CONTENT_DISPOSITION,
                                     ContentDisposition.attachment().filename(archive.fileName()).build().toString())
                             .contentLength(archive.size())
                             .body(archive.content());
    }

    @Override
    @GetMapping("/v1/export/summary")
    public ResponseEntity<ApiResponse<ExportArchiveView>> exportSummary(
            @RequestHeader(SESSION_HEADER) final String sessionId) {
        ExportArchive archive = assetExportService.lastExport(sessionId)
                                                  .orElseThrow(() -> new BatchNotFoundException(sessionId,
                                                                                                BatchKind.EXPORT));
        return ResponseEntity.ok(ApiResponse.success(ExportArchiveView.from(archive),
                                                     "Export summary retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    // --- 4. QUOTA ENDPOINT ---

    @Override
    @GetMapping("/v1/quota")
    public ResponseEntity<ApiResponse<QuotaView>> quota(
            @RequestHeader(SESSION_HEADER) final String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization) {

        QuotaStatusService.QuotaStatus status = quotaStatusService.current(sessionId,
                                                                           RequestAuthentication.fromHeader(authorization));
        return ResponseEntity.ok(ApiResponse.success(QuotaView.of(status.policy(), status.snapshot()),
                                                     "Quota retrieved successfully.", HttpStatus.OK.value()));
    }

    private ResponseEntity<ApiResponse<BatchProgressView>> accepted(ActiveBatch batch, String message) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(BatchProgressView.from(batch), message,
                                                       HttpStatus.ACCEPTED.value()));
    }

    private ResponseEntity<ApiResponse<Boolean>> cancelled(boolean cancelled, BatchKind kind) {
        String message = cancelled ? String.format("The %s batch will stop after the requests in flight.", kind.getValue())
                                   : String.format("No running %s batch to cancel.", kind.getValue());
        return ResponseEntity.ok(ApiResponse.success(cancelled, message, HttpStatus.OK.value()));
    }

    private ResponseEntity<ApiResponse<BatchProgressView>> progress(String sessionId, BatchKind kind) {
        ActiveBatch batch = batchSessionStore.get(sessionId).getBatch(kind)
                                             .orElseThrow(() -> new BatchNotFoundException(sessionId, kind));
        return ResponseEntity.ok(ApiResponse.<BatchProgressView>builder()
                                            .response(BatchProgressView.from(batch))
                                            .showMessage(false)
                                            .statusCode(HttpStatus.OK.value())
                                            .build());
    }

    private ResponseEntity<ApiResponse<AnchorGateResponse>> gateResponse(AnchorGateResult result) {
        HttpStatus status = result.isStarted() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        String message = result.isStarted() ? String.format("Anchoring %d assets.", result.batch().getItems().size())
                                            : result.notice();
        return ResponseEntity.status(status)
                             .body(ApiResponse.success(AnchorGateResponse.from(result), message, status.value()));
    }
}
