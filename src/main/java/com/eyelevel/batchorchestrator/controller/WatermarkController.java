package com.eyelevel.batchorchestrator.controller;

import com.eyelevel.batchorchestrator.dto.common.ApiResponse;
import com.eyelevel.batchorchestrator.dto.embedding.TextEmbedRequest;
import com.eyelevel.batchorchestrator.model.AnchoringStatus;
import com.eyelevel.batchorchestrator.service.anchoring.AnchoringBatchService;
import com.eyelevel.batchorchestrator.service.anchoring.SingleAnchorOutcome;
import com.eyelevel.batchorchestrator.service.embedding.EmbedOutcome;
import com.eyelevel.batchorchestrator.service.embedding.WatermarkEmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * Single embed and anchor requests. These run in the request thread and are not tracked in a session.
 */
@Slf4j
@RestController
@RequestMapping("/watermark")
@RequiredArgsConstructor
@Validated
public class WatermarkController implements WatermarkApi {

    private final WatermarkEmbeddingService watermarkEmbeddingService;
    private final AnchoringBatchService anchoringBatchService;

    @Override
    @PostMapping(value = "/v1/embed", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<EmbedOutcome>> embedFile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization,
            @RequestParam("file") final MultipartFile file,
            @RequestParam(value = "strength", required = false) final Double strength,
            @RequestParam(value = "authorName", required = false) final String authorName) {

        log.info("Embedding single file '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        EmbedOutcome outcome = watermarkEmbeddingService.embedFile(RequestAuthentication.fromHeader(authorization),
                                                                   RequestAuthentication.toMediaFile(file), strength,
                                                                   authorName);
        return embedResponse(outcome);
    }

    @Override
    @PostMapping("/v1/embed/text")
    public ResponseEntity<ApiResponse<EmbedOutcome>> embedText(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization,
            @RequestBody final TextEmbedRequest request) {

        EmbedOutcome outcome = watermarkEmbeddingService.embedText(RequestAuthentication.fromHeader(authorization),
                                                                   request.text(), request.authorName());
        return embedResponse(outcome);
    }

    @Override
    @PostMapping("/v1/anchor/{assetId}")
    public ResponseEntity<ApiResponse<SingleAnchorOutcome>> anchorAsset(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) final String authorization,
            @PathVariable final Long assetId) {

        SingleAnchorOutcome outcome = anchoringBatchService.anchorSingle(RequestAuthentication.fromHeader(authorization),
                                                                         assetId);
        boolean failed = AnchoringStatus.ERROR.getValue().equals(outcome.status());
        HttpStatus status = failed ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK;
        String message = failed ? outcome.message()
                                : outcome.txHash() != null ? "Asset anchored on chain."
                                                           : "Anchoring submitted; the transaction is still confirming.";
        return ResponseEntity.status(status).body(ApiResponse.success(outcome, message, status.value()));
    }

    private ResponseEntity<ApiResponse<EmbedOutcome>> embedResponse(EmbedOutcome outcome) {
        HttpStatus status = outcome.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        String message = outcome.success() ? "Fingerprint embedded successfully." : outcome.message();
        return ResponseEntity.status(status).body(ApiResponse.success(outcome, message, status.value()));
    }
}
