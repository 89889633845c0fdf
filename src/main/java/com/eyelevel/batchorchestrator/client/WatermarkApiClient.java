package com.eyelevel.batchorchestrator.client;

import com.eyelevel.batchorchestrator.client.dto.AnchorResponse;
import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.dto.EmbedResponse;
import com.eyelevel.batchorchestrator.client.dto.TextEmbedPayload;
import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.ApiClient;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.model.ApiRequest;
import com.eyelevel.batchorchestrator.common.apiclient.model.ApiResponse;
import com.eyelevel.batchorchestrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.batchorchestrator.common.json.JsonParser;
import com.eyelevel.batchorchestrator.exception.apiclient.ApiException;
import com.eyelevel.batchorchestrator.exception.apiclient.BadRequestException;
import com.eyelevel.batchorchestrator.exception.apiclient.InternalServerException;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Client for the remote watermarking API. Every operation takes the credentials of the user the
 * call is made for; nothing user-specific is held by the client.
 *
 * <p>Error statuses surface as {@link ApiException} subtypes. Business rejections inside a 200 body
 * are returned as-is for the caller to interpret.
 */
@Slf4j
@Service("watermarkApiClient")
public class WatermarkApiClient extends ApiClient {

    private static final int UPLOAD_CHUNK_SIZE = 64 * 1024;
    private static final TypeReference<List<AssetDto>> ASSET_LIST = new TypeReference<>() {
    };

    private final JsonParser jsonParser;
    private final URI baseUri;

    @Value("${app.watermark-api.endpoint.embed-image:/embed}")
    private String embedImageEndpoint;

    @Value("${app.watermark-api.endpoint.embed-video:/embed/video}")
    private String embedVideoEndpoint;

    @Value("${app.watermark-api.endpoint.embed-text:/embed/text}")
    private String embedTextEndpoint;

    @Value("${app.watermark-api.endpoint.anchor:/anchor/{assetId}}")
    private String anchorEndpoint;

    @Value("${app.watermark-api.endpoint.assets:/assets}")
    private String assetsEndpoint;

    @Value("${app.watermark-api.endpoint.profile:/users/me}")
    private String profileEndpoint;

    public WatermarkApiClient(@Qualifier("watermarkWebClient") final WebClient webClient,
                              @Qualifier("watermarkAuthentication") final Authentication authentication,
                              @Qualifier("watermarkHeader") final HeaderConfig headerConfig,
                              @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                              @Value("${app.watermark-api.base-url}") final String baseUrl,
                              @Value("${app.watermark-api.request-timeout:60s}") final Duration requestTimeout) {
        super(webClient, authentication, headerConfig, requestTimeout);
        this.jsonParser = jsonParser;
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    }

    /**
     * Embeds a fingerprint into an image.
     *
     * @param onUploaded invoked once the last byte of the file has been handed to the transport.
     */
    public EmbedResponse embed(Authentication auth, MediaFile file, double strength, String authorName,
                               Runnable onUploaded) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        addFilePart(builder, "image", file, onUploaded);
        builder.part("strength", String.valueOf(strength));
        builder.part("author_name", authorName == null ? "" : authorName);
        return execute("embedding image '" + file.fileName() + "'", ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(embedImageEndpoint)
                .body(builder.build())
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .authentication(auth)
                .build(), EmbedResponse.class);
    }

    public EmbedResponse embedVideo(Authentication auth, MediaFile file, String authorName, Runnable onUploaded) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        addFilePart(builder, "video", file, onUploaded);
        builder.part("author_name", authorName == null ? "" : authorName);
        return execute("embedding video '" + file.fileName() + "'", ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(embedVideoEndpoint)
                .body(builder.build())
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .authentication(auth)
                .build(), EmbedResponse.class);
    }

    public EmbedResponse embedText(Authentication auth, String text, String authorName) {
        return execute("embedding text", ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(embedTextEndpoint)
                .body(new TextEmbedPayload(text, authorName == null ? "" : authorName))
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .authentication(auth)
                .build(), EmbedResponse.class);
    }

    /**
     * Requests anchoring of an asset. A response without a transaction hash means the request was
     * accepted but is not final yet.
     */
    public AnchorResponse anchorAsset(Authentication auth, long assetId) {
        return execute("anchoring asset " + assetId, ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(anchorEndpoint)
                .pathVariables(Map.of("assetId", assetId))
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .authentication(auth)
                .build(), AnchorResponse.class);
    }

    /**
     * Fetches the authoritative asset list of the user, in the order the server returns it.
     */
    public List<AssetDto> getAssets(Authentication auth) {
        try {
            ApiResponse apiResponse = call(ApiRequest.builder()
                    .method(HttpMethod.GET)
                    .path(assetsEndpoint)
                    .acceptMediaType(MediaType.APPLICATION_JSON)
                    .authentication(auth)
                    .build());
            if (apiResponse == null || apiResponse.getData().length == 0) {
                return Collections.emptyList();
            }
            List<AssetDto> assets = jsonParser.parseObject(apiResponse.getData(), ASSET_LIST);
            return assets == null ? Collections.emptyList() : assets;
        } catch (final ApiException e) {
            log.warn("API error occurred while fetching the asset list.", e);
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while fetching the asset list.", e);
            throw new InternalServerException("Unreadable asset list: " + e.getMessage());
        }
    }

    public UserProfile me(Authentication auth) {
        return execute("fetching the user profile", ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(profileEndpoint)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .authentication(auth)
                .build(), UserProfile.class);
    }

    /**
     * Downloads a stored file. Relative locations such as {@code /api/image/x.png} resolve against
     * the origin of the configured base URL.
     */
    public byte[] downloadAsset(Authentication auth, String location) {
        if (!StringUtils.hasText(location)) {
            throw new BadRequestException("Asset has no download location");
        }
        URI target = baseUri.resolve(location.trim());
        try {
            ApiResponse apiResponse = call(ApiRequest.builder()
                    .method(HttpMethod.GET)
                    .uri(target)
                    .authentication(auth)
                    .build());
            return apiResponse == null ? new byte[0] : apiResponse.getData();
        } catch (final ApiException e) {
            log.warn("API error occurred while downloading '{}'.", target.getPath(), e);
            throw e;
        }
    }

    private <T> T execute(String description, ApiRequest apiRequest, Class<T> responseType) {
        try {
            ApiResponse apiResponse = call(apiRequest);
            if (apiResponse == null) {
                throw new InternalServerException("Empty response while " + description);
            }
            return jsonParser.parseObject(apiResponse.getData(), responseType);
        } catch (final ApiException e) {
            log.warn("API error occurred while {}: status {}", description, e.getStatusCode());
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while {}.", description, e);
            throw new InternalServerException("Unexpected response while " + description + ": " + e.getMessage());
        }
    }

    private static void addFilePart(MultipartBodyBuilder builder, String partName, MediaFile file,
                                    Runnable onUploaded) {
        Flux<DataBuffer> content = DataBufferUtils.readInputStream(() -> new ByteArrayInputStream(file.content()),
                                                                   DefaultDataBufferFactory.sharedInstance,
                                                                   UPLOAD_CHUNK_SIZE);
        if (onUploaded != null) {
            content = content.doOnComplete(onUploaded);
        }
        MediaType contentType = StringUtils.hasText(file.contentType()) ? MediaType.parseMediaType(file.contentType())
                                                                        : MediaType.APPLICATION_OCTET_STREAM;
        builder.asyncPart(partName, content, DataBuffer.class).filename(file.fileName()).contentType(contentType);
    }
}
