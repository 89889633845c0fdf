package com.eyelevel.batchorchestrator.client;

import com.eyelevel.batchorchestrator.client.dto.AssetDto;
import com.eyelevel.batchorchestrator.client.dto.EmbedResponse;
import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.batchorchestrator.common.json.jackson.JacksonJsonParser;
import com.eyelevel.batchorchestrator.exception.apiclient.ApiException;
import com.eyelevel.batchorchestrator.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.batchorchestrator.exception.apiclient.PaymentRequiredException;
import com.eyelevel.batchorchestrator.exception.apiclient.ServiceUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatermarkApiClientTest {

    private static final String BASE_URL = "http://watermark.test/api";

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Authentication user = new BearerTokenAuthentication("user-token");

    private WatermarkApiClient clientAnswering(ExchangeFunction exchange, Duration timeout) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        WebClient webClient = WebClient.builder().baseUrl(BASE_URL).exchangeFunction(recording).build();
        WatermarkApiClient client = new WatermarkApiClient(webClient, new BearerTokenAuthentication("service-token"),
                                                           new HeaderConfig().add("X-Client-Name", "test"),
                                                           new JacksonJsonParser(new ObjectMapper()), BASE_URL,
                                                           timeout);
        ReflectionTestUtils.setField(client, "embedTextEndpoint", "/embed/text");
        ReflectionTestUtils.setField(client, "anchorEndpoint", "/anchor/{assetId}");
        ReflectionTestUtils.setField(client, "assetsEndpoint", "/assets");
        ReflectionTestUtils.setField(client, "profileEndpoint", "/users/me");
        return client;
    }

    private WatermarkApiClient clientAnswering(HttpStatus status, String body) {
        return clientAnswering(request -> Mono.just(ClientResponse.create(status)
                                                                  .header(HttpHeaders.CONTENT_TYPE,
                                                                          MediaType.APPLICATION_JSON_VALUE)
                                                                  .body(body).build()), Duration.ofSeconds(5));
    }

    @Test
    void parsesTheAssetListInServerOrder() {
        WatermarkApiClient client = clientAnswering(HttpStatus.OK, """
                [{"id": 12, "filename": "a.png", "tx_hash": "0xaa", "block_height": 7, "asset_type": "image"},
                 {"id": 13, "filename": "b.png", "preview_url": "/api/image/b.png", "extra": true}]
                """);

        List<AssetDto> assets = client.getAssets(user);

        assertThat(assets).extracting(AssetDto::id).containsExactly(12L, 13L);
        assertThat(assets.get(0).isAnchored()).isTrue();
        assertThat(assets.get(0).blockHeight()).isEqualTo(7L);
        assertThat(assets.get(1).isAnchored()).isFalse();
        assertThat(assets.get(1).downloadLocation()).isEqualTo("/api/image/b.png");
    }

    @Test
    void forwardsTheUsersTokenAndStaticHeaders() {
        WatermarkApiClient client = clientAnswering(HttpStatus.OK, "[]");

        client.getAssets(user);

        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.url().toString()).isEqualTo(BASE_URL + "/assets");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer user-token");
        assertThat(request.headers().getFirst("X-Client-Name")).isEqualTo("test");
    }

    @Test
    void fallsBackToTheServiceTokenWithoutRequestCredentials() {
        WatermarkApiClient client = clientAnswering(HttpStatus.OK, "{\"plan\": \"pro\"}");

        UserProfile profile = client.me(null);

        assertThat(profile.plan()).isEqualTo("pro");
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer service-token");
    }

    @Test
    void paymentRequiredIsMappedToItsOwnException() {
        WatermarkApiClient client = clientAnswering(HttpStatus.PAYMENT_REQUIRED, "{\"detail\": \"quota exceeded\"}");

        assertThatThrownBy(() -> client.anchorAsset(user, 5L))
                .isInstanceOf(PaymentRequiredException.class)
                .satisfies(e -> assertThat(((ApiException) e).getStatusCode()).isEqualTo(402))
                .hasMessageContaining("quota exceeded");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/anchor/5");
    }

    @Test
    void businessRejectionInsideA200BodyIsReturnedAsIs() {
        WatermarkApiClient client = clientAnswering(HttpStatus.OK,
                "{\"success\": false, \"error\": \"WATERMARK_EXISTS\", \"quota_deducted\": false}");

        EmbedResponse response = client.embedText(user, "hello", "alice");

        assertThat(response.isRejected()).isTrue();
        assertThat(response.error()).isEqualTo("WATERMARK_EXISTS");
        assertThat(response.quotaDeducted()).isFalse();
    }

    @Test
    void connectionFailureIsATransportFailure() {
        WatermarkApiClient client = clientAnswering(request -> Mono.error(
                new WebClientRequestException(new ConnectException("refused"), request.method(), request.url(),
                                              request.headers())), Duration.ofSeconds(5));

        assertThatThrownBy(() -> client.getAssets(user))
                .isInstanceOf(ServiceUnavailableException.class)
                .satisfies(e -> assertThat(((ApiException) e).isTransportFailure()).isTrue());
    }

    @Test
    void slowResponseIsBoundedByTheRequestTimeout() {
        WatermarkApiClient client = clientAnswering(request -> Mono.never(), Duration.ofMillis(100));

        assertThatThrownBy(() -> client.me(user))
                .isInstanceOf(GatewayTimeoutException.class)
                .satisfies(e -> assertThat(((ApiException) e).isTransportFailure()).isTrue());
    }

    @Test
    void relativeDownloadLocationsResolveAgainstTheBaseUrlOrigin() {
        WatermarkApiClient client = clientAnswering(HttpStatus.OK, "PNGDATA");

        byte[] data = client.downloadAsset(user, "/api/image/b.png");

        assertThat(new String(data)).isEqualTo("PNGDATA");
        assertThat(requests.get(0).url().toString()).isEqualTo("http://watermark.test/api/image/b.png");
    }
}
