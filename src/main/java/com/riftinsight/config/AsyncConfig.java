package com.riftinsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors used by the analysis pipeline.
 *
 * admissionWaitExecutor:
 *   One thread per request waiting for an analysis slot. No queue, so a waiter
 *   registers with the admission queue as soon as the request arrives.
 *
 * laneLeadExecutor:
 *   Fan-out of per-match timeline fetches. Outbound concurrency is bounded by
 *   the gateway's rate limiter, not by this pool.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "admissionWaitExecutor")
    public Executor admissionWaitExecutor(
            @Value("${app.analysis.max-waiting:512}") int maxWaiting) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Math.max(1, maxWaiting));
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("admission-wait-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "laneLeadExecutor")
    public Executor laneLeadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(21);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("lane-lead-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
