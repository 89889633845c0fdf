package com.eyelevel.batchorchestrator.config;

import com.eyelevel.batchorchestrator.service.reconcile.BackoffSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Beans for polling remote state until it settles.
 */
@Slf4j
@Configuration
public class ReconciliationConfig {

    @Bean("reconciliationSchedule")
    public BackoffSchedule reconciliationSchedule(BatchProcessingConfig batchProcessingConfig) {
        BatchProcessingConfig.Reconciliation reconciliation = batchProcessingConfig.getReconciliation();
        BackoffSchedule schedule = BackoffSchedule.ofMillis(reconciliation.getDelaysMs(), reconciliation.getMaxAttempts());
        log.info("Reconciliation schedule: {} attempts, delays {}", schedule.maxAttempts(), schedule.delays());
        return schedule;
    }

    @Bean("reconciliationSleeper")
    public Sleeper reconciliationSleeper() {
        return new ThreadWaitSleeper();
    }
}
