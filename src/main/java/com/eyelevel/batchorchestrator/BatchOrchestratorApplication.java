package com.eyelevel.batchorchestrator;

import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Batch Orchestrator Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: A composite annotation that enables auto-configuration,
 *     component scanning, and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: Binds custom application properties (prefixed with "app.batch")
 *     to the {@link BatchProcessingConfig} class.</li>
 *     <li>{@link EnableScheduling}: Activates scheduled tasks such as stale session cleanup and delayed
 *     quota refreshes.</li>
 *     <li>{@link EnableRetry}: Enables retries of transient failures when reading the user profile.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = BatchProcessingConfig.class)
@EnableRetry
public class BatchOrchestratorApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting BatchOrchestratorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(BatchOrchestratorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "BatchOrchestrator"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Watermark API: {}", env.getProperty("app.watermark-api.base-url"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
