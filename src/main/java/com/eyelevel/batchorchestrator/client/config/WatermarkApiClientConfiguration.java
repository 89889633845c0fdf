package com.eyelevel.batchorchestrator.client.config;

import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.common.apiclient.model.HeaderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the beans of the watermarking API client: the {@link WebClient}, the fallback
 * credentials and the static headers.
 */
@Slf4j
@Configuration
public class WatermarkApiClientConfiguration {

    @Value("${app.watermark-api.base-url}")
    private String baseUrl;

    @Value("${app.watermark-api.service-token:}")
    private String serviceToken;

    @Value("${app.watermark-api.client-name:batch-orchestrator}")
    private String clientName;

    @Value("${app.watermark-api.max-in-memory-size:50MB}")
    private DataSize maxInMemorySize;

    /**
     * Creates the {@link WebClient} used for the watermarking API. Downloads of whole assets go
     * through the same client, so the in-memory buffer is raised accordingly.
     */
    @Bean("watermarkWebClient")
    public WebClient watermarkWebClient(WebClient.Builder builder) {
        log.info("Initializing watermark API WebClient with base URL: {}", baseUrl);
        return builder.baseUrl(baseUrl)
                      .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) maxInMemorySize.toBytes()))
                      .build();
    }

    /**
     * Credentials used when a request carries none of its own. Normally every request forwards the
     * end user's token and this stays empty.
     */
    @Bean("watermarkAuthentication")
    public Authentication watermarkAuthentication() {
        if (serviceToken == null || serviceToken.isBlank()) {
            log.info("No service token configured for the watermark API; requests rely on forwarded user tokens.");
        }
        return new BearerTokenAuthentication(serviceToken);
    }

    @Bean("watermarkHeader")
    public HeaderConfig watermarkHeader() {
        return new HeaderConfig().add("X-Client-Name", clientName);
    }
}
