package com.eyelevel.batchorchestrator.controller;

import com.eyelevel.batchorchestrator.dto.common.ApiResponse;
import com.eyelevel.batchorchestrator.dto.embedding.TextEmbedRequest;
import com.eyelevel.batchorchestrator.service.anchoring.SingleAnchorOutcome;
import com.eyelevel.batchorchestrator.service.embedding.EmbedOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Single Operations", description = "One-off embedding and anchoring outside of a batch.")
public interface WatermarkApi {

    @Operation(summary = "Embed One File",
            description = "Embeds a fingerprint into one image or video. For images the call waits briefly until the new asset shows up in the asset list.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Embedded."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "402", description = "Payment Required - The plan quota is exhausted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "The server rejected the file; the body carries the error code and remediation.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<EmbedOutcome>> embedFile(
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization,
            @Parameter(description = "The image or video.", required = true) @RequestParam("file") MultipartFile file,
            @RequestParam(value = "strength", required = false)
            @DecimalMin(value = "0.0", inclusive = false, message = "The 'strength' must be positive.")
            @DecimalMax(value = "1.0", message = "The 'strength' cannot exceed 1.0.") Double strength,
            @RequestParam(value = "authorName", required = false) String authorName);

    @Operation(summary = "Embed Text", description = "Embeds an invisible fingerprint into plain text and returns the marked text.")
    ResponseEntity<ApiResponse<EmbedOutcome>> embedText(
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody TextEmbedRequest request);

    @Operation(summary = "Anchor One Asset",
            description = "Records the asset's fingerprint on chain and waits within the reconciliation schedule for the transaction hash.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Anchored or still confirming."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "402", description = "Payment Required - The plan quota is exhausted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SingleAnchorOutcome>> anchorAsset(
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization,
            @Parameter(description = "The asset id.", required = true, example = "42")
            @PathVariable @Positive(message = "The 'assetId' must be a positive number.") Long assetId);
}
