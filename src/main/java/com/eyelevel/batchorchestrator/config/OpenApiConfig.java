package com.eyelevel.batchorchestrator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Batch Orchestrator API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Runs batches of watermark embedding, blockchain anchoring and asset export
                                against the watermarking API on behalf of a browser session.
                                
                                Key features include:
                                * **Plan-aware concurrency:** Each batch runs at most as many requests in parallel as the user's plan allows.
                                * **Quota gate:** Bulk anchoring above the plan's batch size asks the user to cap, upgrade or cancel.
                                * **Per-item outcomes:** One failed item never fails the batch; each carries an error code and remediation.
                                * **Reconciliation:** Optimistic results are confirmed against the asset list with a bounded backoff.
                                
                                **Note:** Every batch endpoint is scoped by the `X-Session-Id` header.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
