package com.eyelevel.batchorchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the thread pool that runs batch workers. Each running batch borrows at most its plan's
 * concurrency from this pool, so the pool size bounds the work of all sessions together.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * @return the executor shared by all batch workers, sized from {@code app.batch.executor.*}.
     */
    @Bean("batchTaskExecutor")
    public AsyncTaskExecutor batchTaskExecutor(@Value("${app.batch.executor.core-size:8}") int coreSize,
                                               @Value("${app.batch.executor.max-size:32}") int maxSize,
                                               @Value("${app.batch.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("batch-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
