package com.riftinsight.config;

import com.riftinsight.infrastructure.riot.UpstreamException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP and retry setup for the Riot API client.
 *
 * The JDK request factory never decompresses responses on its own; encoding
 * checks happen in RiotApiClient.
 */
@Configuration
public class RiotClientConfig {

    @Bean
    public RestTemplate riotRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.riot.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${app.riot.read-timeout-ms:10000}") long readTimeoutMs) {
        return builder
                .requestFactory(SimpleClientHttpRequestFactory::new)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public Retry riotApiRetry(
            @Value("${app.riot.retry.max-attempts:3}") int maxAttempts,
            @Value("${app.riot.retry.initial-backoff-ms:500}") long initialBackoffMs,
            @Value("${app.riot.retry.multiplier:2.0}") double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(initialBackoffMs), multiplier))
                .retryOnException(ex -> ex instanceof UpstreamException
                        && ((UpstreamException) ex).isRetryable())
                .build();
        return Retry.of("riotApi", config);
    }
}
