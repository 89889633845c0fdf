package com.eyelevel.batchorchestrator.client.result;

import com.eyelevel.batchorchestrator.client.WatermarkApiClient;
import com.eyelevel.batchorchestrator.client.dto.AnchorResponse;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.dto.EmbedResponse;
import com.eyelevel.batchorchestrator.client.dto.RemoteErrorBody;
import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.client.result.RemoteResult.ErrorKind;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.json.JsonParser;
import com.eyelevel.batchorchestrator.exception.apiclient.ApiException;
import com.eyelevel.batchorchestrator.exception.apiclient.ForbiddenException;
import com.eyelevel.batchorchestrator.exception.apiclient.PaymentRequiredException;
import com.eyelevel.batchorchestrator.exception.apiclient.UnauthorizedException;
import com.eyelevel.batchorchestrator.model.AnchorReceipt;
import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.model.MediaKind;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.function.Supplier;

/**
 * Wraps {@link WatermarkApiClient} so that callers never see an exception: every call comes back
 * as a {@link RemoteResult}. HTTP failures are classified by status; 200 bodies with
 * {@code success=false} become {@link ErrorKind#BUSINESS_REJECTION} carrying the server's code.
 */
@Slf4j
@Component
public class RemoteOperationAdapter {

    private static final int MAX_MESSAGE_LENGTH = 300;

    private final WatermarkApiClient apiClient;
    private final JsonParser jsonParser;

    public RemoteOperationAdapter(WatermarkApiClient apiClient, @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        this.apiClient = apiClient;
        this.jsonParser = jsonParser;
    }

    /**
     * Uploads a file for embedding, picking the image or video endpoint from the file's kind.
     */
    public RemoteResult<EmbedResult> embed(Authentication auth, MediaFile file, double strength, String authorName,
                                           Runnable onUploaded) {
        RemoteResult<EmbedResponse> response = invoke("embed " + file.fileName(), ErrorCode.EMBED_FAILED,
                () -> file.kind() == MediaKind.VIDEO
                      ? apiClient.embedVideo(auth, file, authorName, onUploaded)
                      : apiClient.embed(auth, file, strength, authorName, onUploaded));
        return unwrapEmbed(file.fileName(), response);
    }

    public RemoteResult<EmbedResponse> embedText(Authentication auth, String text, String authorName) {
        RemoteResult<EmbedResponse> response = invoke("embed text", ErrorCode.EMBED_FAILED,
                                                      () -> apiClient.embedText(auth, text, authorName));
        if (response.isOk() && response.getValue().isRejected()) {
            return rejection(response.getValue().error(), response.getValue().message(),
                             response.getValue().quotaDeducted(), ErrorCode.EMBED_FAILED);
        }
        return response;
    }

    public RemoteResult<AnchorReceipt> anchor(Authentication auth, long assetId) {
        RemoteResult<AnchorResponse> response = invoke("anchor asset " + assetId, ErrorCode.ANCHOR_FAILED,
                                                       () -> apiClient.anchorAsset(auth, assetId));
        if (!response.isOk()) {
            return response.castError();
        }
        AnchorResponse body = response.getValue();
        if (body.isRejected()) {
            return rejection(body.error(), body.message(), null, ErrorCode.ANCHOR_FAILED);
        }
        return RemoteResult.ok(body.toReceipt());
    }

    public RemoteResult<List<AssetDto>> assets(Authentication auth) {
        return invoke("fetch assets", ErrorCode.UNKNOWN, () -> apiClient.getAssets(auth));
    }

    public RemoteResult<UserProfile> profile(Authentication auth) {
        return invoke("fetch profile", ErrorCode.UNKNOWN, () -> apiClient.me(auth));
    }

    public RemoteResult<byte[]> download(Authentication auth, String location) {
        return invoke("download " + location, ErrorCode.DOWNLOAD_FAILED,
                      () -> apiClient.downloadAsset(auth, location));
    }

    /**
     * Runs a call and folds any failure into a {@link RemoteResult}.
     *
     * @param failureCode the code recorded when the server failed without naming a reason.
     */
    public <T> RemoteResult<T> invoke(String description, ErrorCode failureCode, Supplier<T> call) {
        try {
            return RemoteResult.ok(call.get());
        } catch (ApiException e) {
            RemoteResult<T> classified = classify(e, failureCode);
            log.debug("Remote call '{}' failed: {}", description, classified);
            return classified;
        } catch (RuntimeException e) {
            log.error("Remote call '{}' failed unexpectedly", description, e);
            return RemoteResult.err(ErrorKind.SERVER, failureCode.getValue(), failureCode.getSummary(),
                                    QuotaDeduction.UNKNOWN);
        }
    }

    private RemoteResult<EmbedResult> unwrapEmbed(String fileName, RemoteResult<EmbedResponse> response) {
        if (!response.isOk()) {
            return response.castError();
        }
        EmbedResponse body = response.getValue();
        if (body.isRejected()) {
            log.warn("Embedding of '{}' was rejected with code '{}'", fileName, body.error());
            return rejection(body.error(), body.message(), body.quotaDeducted(), ErrorCode.EMBED_FAILED);
        }
        return RemoteResult.ok(body.toResult());
    }

    private static <T> RemoteResult<T> rejection(String rawCode, String serverMessage, Boolean quotaDeducted,
                                                 ErrorCode fallback) {
        String code = StringUtils.hasText(rawCode) ? rawCode.trim() : fallback.getValue();
        String message = ErrorCode.describe(code, serverMessage, fallback.getSummary());
        return RemoteResult.err(ErrorKind.BUSINESS_REJECTION, code, message, QuotaDeduction.fromFlag(quotaDeducted));
    }

    private <T> RemoteResult<T> classify(ApiException e, ErrorCode failureCode) {
        String serverMessage = extractMessage(e.getMessage());
        if (e instanceof PaymentRequiredException) {
            return RemoteResult.err(ErrorKind.QUOTA_EXHAUSTED, ErrorCode.QUOTA_EXHAUSTED.getValue(),
                                    StringUtils.hasText(serverMessage) ? serverMessage
                                                                       : ErrorCode.QUOTA_EXHAUSTED.getSummary(),
                                    QuotaDeduction.NOT_DEDUCTED);
        }
        if (e instanceof UnauthorizedException || e instanceof ForbiddenException) {
            return RemoteResult.err(ErrorKind.UNAUTHORIZED, ErrorCode.REQUEST_REJECTED.getValue(),
                                    StringUtils.hasText(serverMessage) ? serverMessage
                                                                       : ErrorCode.REQUEST_REJECTED.getSummary(),
                                    QuotaDeduction.NOT_DEDUCTED);
        }
        if (e.isTransportFailure()) {
            return RemoteResult.err(ErrorKind.TRANSPORT, ErrorCode.NETWORK_ERROR.getValue(),
                                    ErrorCode.NETWORK_ERROR.getSummary(), QuotaDeduction.UNKNOWN);
        }
        int status = e.getStatusCode();
        if (status >= 400 && status < 500 && status != 429) {
            return RemoteResult.err(ErrorKind.BUSINESS_REJECTION, ErrorCode.REQUEST_REJECTED.getValue(),
                                    StringUtils.hasText(serverMessage) ? serverMessage
                                                                       : ErrorCode.REQUEST_REJECTED.getSummary(),
                                    QuotaDeduction.NOT_DEDUCTED);
        }
        // 502-504 may come from a proxy after the upstream already did the work
        QuotaDeduction quota = status >= 502 && status <= 504 ? QuotaDeduction.UNKNOWN : QuotaDeduction.NOT_DEDUCTED;
        return RemoteResult.err(ErrorKind.SERVER, failureCode.getValue(),
                                StringUtils.hasText(serverMessage) ? serverMessage : failureCode.getSummary(), quota);
    }

    private String extractMessage(String body) {
        if (!StringUtils.hasText(body)) {
            return null;
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                RemoteErrorBody errorBody = jsonParser.parseObject(trimmed, RemoteErrorBody.class);
                String message = errorBody.bestMessage();
                if (StringUtils.hasText(message)) {
                    return abbreviate(message);
                }
            } catch (RuntimeException e) {
                log.debug("Error body is not the expected JSON shape: {}", e.getMessage());
            }
        }
        return trimmed.startsWith("<") ? null : abbreviate(trimmed);
    }

    private static String abbreviate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
