package com.eyelevel.batchorchestrator.service.embedding;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.dto.EmbedResponse;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.exception.QuotaExhaustedException;
import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.model.MediaKind;
import com.eyelevel.batchorchestrator.service.reconcile.ReconcileOutcome;
import com.eyelevel.batchorchestrator.service.reconcile.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Single image, video and text embedding. An exhausted quota is raised as
 * {@link QuotaExhaustedException}; every other failure is returned in the {@link EmbedOutcome}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatermarkEmbeddingService {

    private final RemoteOperationAdapter remoteOperationAdapter;
    private final WatermarkApiClient watermarkApiClient;
    private final ReconciliationService reconciliationService;
    private final BatchProcessingConfig batchProcessingConfig;

    /**
     * Embeds an image or video, then waits for the fingerprint to appear in the asset list.
     */
    public EmbedOutcome embedFile(Authentication auth, MediaFile file, Double strength, String authorName) {
        double effectiveStrength = strength == null ? batchProcessingConfig.getEmbedding().getDefaultStrength()
                                                    : strength;
        RemoteResult<EmbedResult> result = remoteOperationAdapter.embed(auth, file, effectiveStrength, authorName,
                                                                        null);
        if (!result.isOk()) {
            return failure(file.fileName(), result);
        }
        EmbedResult embedResult = result.getValue();
        boolean visible = file.kind() == MediaKind.IMAGE && awaitFingerprint(auth, embedResult.fingerprint());
        log.info("Embedded '{}' with fingerprint {} (listed: {})", file.fileName(), embedResult.fingerprint(),
                 visible);
        return EmbedOutcome.succeeded(embedResult, null, visible);
    }

    public EmbedOutcome embedText(Authentication auth, String text, String authorName) {
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("Text to embed must not be empty");
        }
        RemoteResult<EmbedResponse> result = remoteOperationAdapter.embedText(auth, text, authorName);
        if (!result.isOk()) {
            return failure("text", result);
        }
        EmbedResponse response = result.getValue();
        return EmbedOutcome.succeeded(response.toResult(), response.watermarkedText(), false);
    }

    private boolean awaitFingerprint(Authentication auth, String fingerprint) {
        if (!StringUtils.hasText(fingerprint)) {
            return false;
        }
        ReconcileOutcome<List<AssetDto>> outcome = reconciliationService.awaitConfirmation(
                "asset with fingerprint " + fingerprint,
                () -> watermarkApiClient.getAssets(auth),
                assets -> assets.stream().anyMatch(asset -> fingerprint.equals(asset.fingerprint())));
        return outcome.confirmed();
    }

    private EmbedOutcome failure(String subject, RemoteResult<?> result) {
        if (result.isQuotaExhausted()) {
            log.warn("Quota exhausted while embedding {}", subject);
            throw new QuotaExhaustedException(result.getMessage(), batchProcessingConfig.getUpgradePath());
        }
        log.warn("Embedding {} failed: {} ({})", subject, result.getCode(), result.getErrorKind());
        return EmbedOutcome.failed(result.getCode(), result.getMessage(), result.getQuotaDeducted());
    }
}
