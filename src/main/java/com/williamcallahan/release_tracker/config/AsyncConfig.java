/**
 * Configuration for the worker pool that processes artists during discovery
 *
 * @author William Callahan
 *
 * Features:
 * - Fixed pool sized by app.discovery.worker-threads, one artist per task
 * - Unbounded queue so every requested artist is accepted up front
 * - Descriptive thread naming for log correlation
 */

package com.williamcallahan.release_tracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Creates the executor used by the fetch orchestrator
     *
     * @return Configured AsyncTaskExecutor for per-artist fetch tasks
     */
    @Bean("artistFetchExecutor")
    public AsyncTaskExecutor artistFetchExecutor(AppConfigurationProperties properties) {
        int workers = Math.max(1, properties.getDiscovery().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("artist-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
