package com.riftinsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * MVC setup: the executor that runs streaming responses, and CORS.
 *
 * Streams may sit in the admission queue for a long time, so the async
 * timeout is generous. ALLOWED_ORIGINS="*" allows every origin without
 * credentials.
 *
 * The stream executor has no task queue: every accepted stream gets a thread at
 * once and registers with the admission queue, where it is visible in queue
 * stats and positions. Streams beyond max-concurrent + max-waiting are rejected.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final int CORE_STREAM_THREADS = 8;

    private final String[] allowedOrigins;
    private final long streamTimeoutMs;
    private final int maxStreams;

    public WebConfig(
            @Value("${app.cors.allowed-origins:http://localhost:3000}") String allowedOrigins,
            @Value("${app.analysis.stream-timeout-ms:900000}") long streamTimeoutMs,
            @Value("${app.analysis.max-concurrent:3}") int maxConcurrent,
            @Value("${app.analysis.max-waiting:512}") int maxWaiting) {
        this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
        this.streamTimeoutMs = streamTimeoutMs;
        this.maxStreams = Math.max(1, maxConcurrent) + Math.max(1, maxWaiting);
    }

    @Bean(name = "mvcStreamExecutor")
    public AsyncTaskExecutor mvcStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(CORE_STREAM_THREADS, maxStreams));
        executor.setMaxPoolSize(maxStreams);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("analysis-stream-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(mvcStreamExecutor());
        configurer.setDefaultTimeout(streamTimeoutMs);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean allowAll = allowedOrigins.length == 1 && "*".equals(allowedOrigins[0]);
        registry.addMapping("/**")
                .allowedOriginPatterns(allowAll ? new String[]{"*"} : allowedOrigins)
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(!allowAll);
    }
}
