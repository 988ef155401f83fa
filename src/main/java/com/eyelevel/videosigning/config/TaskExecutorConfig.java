package com.eyelevel.videosigning.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded worker pool that runs background signing jobs. Each job spawns an
 * external signer process, so the pool size caps how many signer processes run at once.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the signing worker pool. Core and max size are equal; excess submissions wait in
     * the queue and are rejected once it is full.
     *
     * @param config The signing configuration providing pool size and queue capacity.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("signingTaskExecutor")
    public AsyncTaskExecutor signingTaskExecutor(final VideoSigningConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorker().getPoolSize());
        executor.setMaxPoolSize(config.getWorker().getPoolSize());
        executor.setQueueCapacity(config.getWorker().getQueueCapacity());
        executor.setThreadNamePrefix("signing-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
