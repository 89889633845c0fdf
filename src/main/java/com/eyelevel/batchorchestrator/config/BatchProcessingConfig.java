package com.eyelevel.batchorchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds application properties under the "app.batch" prefix: plan limits, reconciliation
 * schedule, quota refresh, export and embedding settings.
 */
@Data
@ConfigurationProperties(prefix = "app.batch")
public class BatchProcessingConfig {

    /**
     * Plan limits keyed by plan value ({@code free}, {@code personal}, {@code pro}, {@code enterprise}).
     */
    private Map<String, PlanLimits> plans = new LinkedHashMap<>();
    private Reconciliation reconciliation = new Reconciliation();
    private QuotaRefresh quotaRefresh = new QuotaRefresh();
    private Export export = new Export();
    private Embedding embedding = new Embedding();
    private String upgradePath = "/pricing";

    @Data
    public static class PlanLimits {
        private int maxConcurrency;
        /**
         * Empty means unbounded.
         */
        private Integer maxBatchSize;
    }

    @Data
    public static class Reconciliation {
        /**
         * Delay before each polling attempt, in milliseconds. The number of entries is the attempt limit.
         */
        private List<Long> delaysMs = new ArrayList<>(List.of(0L, 300L, 800L, 1500L, 2500L));
        private int maxAttempts = 5;
    }

    @Data
    public static class QuotaRefresh {
        private boolean enabled = true;
        private List<Long> delaysMs = new ArrayList<>(List.of(2000L, 5000L));
    }

    @Data
    public static class Export {
        private int concurrency = 3;
        private String archivePrefix = "copyright-assets";
    }

    @Data
    public static class Embedding {
        private double defaultStrength = 0.1;
    }
}
