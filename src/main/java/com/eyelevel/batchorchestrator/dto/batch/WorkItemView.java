package com.eyelevel.batchorchestrator.dto.batch;

import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.eyelevel.batchorchestrator.model.AnchoringWorkItem;
import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.EmbeddingWorkItem;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.ExportWorkItem;
import com.eyelevel.batchorchestrator.model.WorkItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A work item as shown in the batch list. Fields of other item kinds are left out.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkItemView(
        String id,
        String name,
        String status,
        String errorCode,
        String error,
        List<String> remediation,
        String quotaDeducted,
        Instant updatedAt,
        // embedding
        Long fileSize,
        String mediaKind,
        String fingerprint,
        Double psnr,
        String downloadUrl,
        Long assetId,
        // anchoring
        String badge,
        String txHash,
        Long blockHeight,
        // export
        String assetType,
        Long downloadedBytes
) {

    public static WorkItemView from(WorkItem<?> item) {
        WorkItemViewBuilder builder = WorkItemView.builder()
                                                  .id(item.getId())
                                                  .name(item.getName())
                                                  .status(item.getStatus().getValue())
                                                  .updatedAt(item.getUpdatedAt());
        if (item.isFailed()) {
            builder.errorCode(item.getErrorCode())
                   .error(item.getError())
                   .remediation(ErrorCode.fromValue(item.getErrorCode()).getRemediation())
                   .quotaDeducted(item.getQuotaDeducted().getValue());
        }
        if (item instanceof EmbeddingWorkItem embedding) {
            builder.fileSize(embedding.getFile().size()).mediaKind(embedding.getFile().kind().getValue());
            EmbedResult result = embedding.getResult();
            if (result != null) {
                builder.fingerprint(result.fingerprint())
                       .psnr(result.psnr())
                       .downloadUrl(result.downloadUrl())
                       .assetId(result.assetId());
            }
        } else if (item instanceof AnchoringWorkItem anchoring) {
            builder.assetId(anchoring.getAssetId()).badge(anchoring.badge().getValue());
            AnchorReceipt receipt = anchoring.getReceipt();
            if (receipt != null) {
                builder.txHash(receipt.txHash()).blockHeight(receipt.blockHeight());
            }
        } else if (item instanceof ExportWorkItem export) {
            builder.assetId(export.getAssetId()).assetType(export.getAssetType())
                   .downloadedBytes(export.getDownloadedBytes());
        }
        return builder.build();
    }
}
