package com.riftinsight.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * In-process cache for upstream responses that never change once produced.
 *
 * Caching Strategy:
 * - Completed match records and match timelines: cached until evicted
 * - Static data version list: cached until evicted
 * - Ranked standings, accounts, summoners: never cached (they change)
 *
 * Size-bounded; Caffeine evicts by frequency and recency once full.
 */
@Slf4j
@Service
public class ImmutableResponseCache {

    private final Cache<String, JsonNode> cache;
    private final Counter hits;
    private final Counter misses;

    public ImmutableResponseCache(
            @Value("${app.cache.max-entries:2000}") long maxEntries,
            MeterRegistry meterRegistry) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .build();
        this.hits = Counter.builder("upstream.cache")
                .tag("result", "hit")
                .register(meterRegistry);
        this.misses = Counter.builder("upstream.cache")
                .tag("result", "miss")
                .register(meterRegistry);
    }

    /**
     * Get cached response.
     */
    public Optional<JsonNode> get(String key) {
        JsonNode cached = cache.getIfPresent(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            misses.increment();
            return Optional.empty();
        }
        log.debug("Cache hit for key: {}", key);
        hits.increment();
        return Optional.of(cached);
    }

    /**
     * Store response. Callers only store successful, immutable payloads.
     */
    public void put(String key, JsonNode value) {
        cache.put(key, value);
        log.debug("Cached response for key: {}", key);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Generate cache key from request parameters.
     */
    public String generateCacheKey(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }
}
