package com.eyelevel.batchorchestrator.controller;

import com.eyelevel.batchorchestrator.dto.anchoring.AnchorGateResponse;
import com.eyelevel.batchorchestrator.dto.anchoring.GateDecisionRequest;
import com.eyelevel.batchorchestrator.dto.batch.BatchProgressView;
import com.eyelevel.batchorchestrator.dto.batch.WorkItemView;
import com.eyelevel.batchorchestrator.dto.common.ApiResponse;
import com.eyelevel.batchorchestrator.dto.export.ExportArchiveView;
import com.eyelevel.batchorchestrator.dto.quota.QuotaView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Batch Processing", description = "Session-scoped batches of embedding, anchoring and export with plan-aware concurrency.")
public interface BatchProcessingApi {

    // --- Embedding ---

    @Operation(summary = "Queue Files for Embedding",
            description = "Adds the uploaded images or videos to the session's embedding list as pending items. Nothing is sent to the watermarking API until a batch is started.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Files queued.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - No files or unreadable upload.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<WorkItemView>>> enqueueFiles(
            @Parameter(description = "Identifies the browser session that owns the batch.", required = true)
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(description = "Images or videos to embed.", required = true)
            @RequestParam("files") List<MultipartFile> files);

    @Operation(summary = "List Embedding Items", description = "Returns every item of the session's embedding list with its status and, for failures, the error code and remediation hints.")
    ResponseEntity<ApiResponse<List<WorkItemView>>> listEmbeddingItems(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Remove a Pending Item", description = "Removes an item that has not been picked up by a batch yet.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Item removed."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The item is unknown, already processed, or a batch is running.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> removeEmbeddingItem(@RequestHeader("X-Session-Id") String sessionId,
                                                          @Parameter(description = "The item id.", required = true) @PathVariable String itemId);

    @Operation(summary = "Clear Finished Items", description = "Drops succeeded and failed items from the embedding list.")
    ResponseEntity<ApiResponse<Integer>> clearFinishedEmbeddingItems(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Requeue Failed Items", description = "Replaces every failed item with a new pending item for the same file.")
    ResponseEntity<ApiResponse<List<WorkItemView>>> requeueFailed(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Start Embedding Batch",
            description = "Embeds every pending item, running at most as many uploads in parallel as the user's plan allows. Returns immediately; poll the progress endpoint.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Batch started.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Started", value = """
                                    {
                                        "displayMessage": "Embedding batch started.",
                                        "response": {
                                            "runId": "5d0c...",
                                            "kind": "embedding",
                                            "state": "running",
                                            "done": 0,
                                            "total": 5,
                                            "succeeded": 0,
                                            "errors": 0,
                                            "percent": 0,
                                            "elapsedMillis": 3,
                                            "items": []
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - An embedding batch is already running.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchProgressView>> startEmbedding(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization,
            @Parameter(description = "Watermark strength, defaults to the configured value.", example = "0.1")
            @RequestParam(value = "strength", required = false)
            @DecimalMin(value = "0.0", inclusive = false, message = "The 'strength' must be positive.")
            @DecimalMax(value = "1.0", message = "The 'strength' cannot exceed 1.0.") Double strength,
            @Parameter(description = "Author recorded with the fingerprint.")
            @RequestParam(value = "authorName", required = false) String authorName);

    @Operation(summary = "Cancel Embedding Batch", description = "Stops handing out queued items. Requests already in flight finish normally.")
    ResponseEntity<ApiResponse<Boolean>> cancelEmbedding(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Embedding Progress", description = "Progress and items of the running or most recent embedding batch.")
    ResponseEntity<ApiResponse<BatchProgressView>> embeddingProgress(@RequestHeader("X-Session-Id") String sessionId);

    // --- Anchoring ---

    @Operation(summary = "Request Bulk Anchoring",
            description = "Anchors every asset that has no transaction hash yet. If the count exceeds the plan's batch size, a ticket is returned and nothing starts until the user decides.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Batch started."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Nothing pending, or a decision is required.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Confirmation required", value = """
                                    {
                                        "displayMessage": "37 assets are pending but the plan allows 10 per batch.",
                                        "response": {
                                            "decision": "CONFIRMATION_REQUIRED",
                                            "pendingCount": 37,
                                            "limit": 10,
                                            "overflow": 27,
                                            "ticketId": "1b4e28ba-2fa1-11d2-883f-0016d3cca427",
                                            "upgradePath": "/pricing"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<AnchorGateResponse>> requestBulkAnchor(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization);

    @Operation(summary = "Answer the Quota Gate", description = "Cancels, upgrades, processes the first items up to the plan's limit, or processes all pending items.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Batch started."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cancelled or redirected to upgrade."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown or already answered ticket.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<AnchorGateResponse>> decideBulkAnchor(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "The ticket and the user's choice.", required = true)
            @Valid @RequestBody GateDecisionRequest request);

    @Operation(summary = "Refresh Anchoring Status", description = "Re-reads the asset list and applies transaction hashes that arrived after the batch ended.")
    ResponseEntity<ApiResponse<Integer>> refreshAnchoring(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization);

    @Operation(summary = "Cancel Anchoring Batch")
    ResponseEntity<ApiResponse<Boolean>> cancelAnchoring(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Anchoring Progress")
    ResponseEntity<ApiResponse<BatchProgressView>> anchoringProgress(@RequestHeader("X-Session-Id") String sessionId);

    // --- Export ---

    @Operation(summary = "Start Asset Export", description = "Downloads every asset of the user into a ZIP archive with a manifest.")
    ResponseEntity<ApiResponse<BatchProgressView>> startExport(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization);

    @Operation(summary = "Cancel Asset Export")
    ResponseEntity<ApiResponse<Boolean>> cancelExport(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Export Progress")
    ResponseEntity<ApiResponse<BatchProgressView>> exportProgress(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Download Export Archive", description = "Streams the ZIP produced by the last finished export of the session.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The archive.",
                    content = @Content(mediaType = "application/zip")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No finished export in this session.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<byte[]> downloadExport(@RequestHeader("X-Session-Id") String sessionId);

    @Operation(summary = "Export Summary", description = "Counts and file name of the last finished export, without the archive bytes.")
    ResponseEntity<ApiResponse<ExportArchiveView>> exportSummary(@RequestHeader("X-Session-Id") String sessionId);

    // --- Quota ---

    @Operation(summary = "Current Quota", description = "Plan limits and the latest quota counters of the signed-in user.")
    ResponseEntity<ApiResponse<QuotaView>> quota(
            @RequestHeader("X-Session-Id") String sessionId,
            @Parameter(hidden = true) @RequestHeader(value = "Authorization", required = false) String authorization);
}
