package com.riftinsight.infrastructure.riot;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.model.RateLimiterStats;
import com.riftinsight.infrastructure.cache.ImmutableResponseCache;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point for every call to the Riot API and Data Dragon.
 *
 * Call Flow (per operation):
 * 1. Return the cached body for immutable resources (match, timeline, versions)
 * 2. Acquire one rate-limiter permit for the HTTP attempt
 * 3. On a malformed (mis-encoded) response, retry once without compression
 * 4. Retry rate-limited/transient failures with exponential backoff
 * 5. Map the outcome to Found / Absent / Failed
 *
 * A 404 is an expected outcome (no ranked entry, no timeline for a remake) and
 * becomes {@link UpstreamResult#absent()}, never an exception.
 */
@Slf4j
@Service
public class UpstreamGateway {

    public static final int RANKED_SOLO_QUEUE = 420;

    private final RiotApiClient apiClient;
    private final RiotEndpoints endpoints;
    private final ImmutableResponseCache cache;
    private final Retry retry;
    private final UpstreamRateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final Counter fallbacks;

    public UpstreamGateway(
            RiotApiClient apiClient,
            RiotEndpoints endpoints,
            ImmutableResponseCache cache,
            @Qualifier("riotApiRetry") Retry retry,
            MeterRegistry meterRegistry,
            @Value("${app.riot.max-concurrent:5}") int maxConcurrent) {
        this.apiClient = apiClient;
        this.endpoints = endpoints;
        this.cache = cache;
        this.retry = retry;
        this.meterRegistry = meterRegistry;
        this.rateLimiter = new UpstreamRateLimiter(maxConcurrent);
        this.fallbacks = Counter.builder("upstream.fallback")
                .tag("reason", "malformed_response")
                .register(meterRegistry);
        Counter retries = Counter.builder("upstream.retry").register(meterRegistry);
        retry.getEventPublisher().onRetry(event -> retries.increment());

        log.info("Upstream gateway initialised: maxConcurrent={}", rateLimiter.getMaxConcurrent());
    }

    public RateLimiterStats limits() {
        return rateLimiter.stats();
    }

    public UpstreamResult<JsonNode> accountByRiotId(String regionalRouting, String gameName, String tagLine) {
        return call("accountByRiotId", endpoints.accountByRiotId(regionalRouting, gameName, tagLine));
    }

    public UpstreamResult<JsonNode> summonerByPuuid(String platformRegion, String puuid) {
        return call("summonerByPuuid", endpoints.summonerByPuuid(platformRegion, puuid));
    }

    public UpstreamResult<List<String>> matchHistoryIds(String regionalRouting, String puuid, int count, int queue) {
        return call("matchHistoryIds", endpoints.matchIdsByPuuid(regionalRouting, puuid, queue, count))
                .map(UpstreamGateway::textValues);
    }

    /**
     * Completed match record. Immutable once the game has ended, so it is cached.
     */
    public UpstreamResult<JsonNode> matchDetails(String regionalRouting, String matchId) {
        return cachedCall("matchDetails",
                cache.generateCacheKey("match", regionalRouting, matchId),
                endpoints.match(regionalRouting, matchId));
    }

    /**
     * Match timeline. Absent for remakes and some queues.
     */
    public UpstreamResult<JsonNode> matchTimeline(String regionalRouting, String matchId) {
        return cachedCall("matchTimeline",
                cache.generateCacheKey("timeline", regionalRouting, matchId),
                endpoints.matchTimeline(regionalRouting, matchId));
    }

    /**
     * Ranked standings. Live data: never cached.
     */
    public UpstreamResult<List<JsonNode>> leagueEntries(String platformRegion, String puuid) {
        return call("leagueEntries", endpoints.leagueEntriesByPuuid(platformRegion, puuid))
                .map(UpstreamGateway::elements);
    }

    public UpstreamResult<String> latestStaticVersion() {
        UpstreamResult<JsonNode> versions = cachedCall("latestStaticVersion",
                cache.generateCacheKey("ddragon", "versions"),
                endpoints.staticDataVersions());
        if (versions.isFound() && textValues(versions.orElse(null)).isEmpty()) {
            return UpstreamResult.failed(UpstreamFailureKind.MALFORMED_RESPONSE, "Empty version list");
        }
        return versions.map(node -> node.get(0).asText());
    }

    private UpstreamResult<JsonNode> cachedCall(String operation, String cacheKey, URI uri) {
        Optional<JsonNode> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            return UpstreamResult.found(cached.get());
        }
        UpstreamResult<JsonNode> result = call(operation, uri);
        if (result.isFound()) {
            cache.put(cacheKey, result.orElse(null));
        }
        return result;
    }

    private UpstreamResult<JsonNode> call(String operation, URI uri) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "found";
        try {
            JsonNode body = retry.executeSupplier(() -> fetchWithFallback(operation, uri));
            return UpstreamResult.found(body);
        } catch (UpstreamException e) {
            if (e.getKind() == UpstreamFailureKind.NOT_FOUND) {
                outcome = "absent";
                log.debug("{} absent: {}", operation, uri.getPath());
                return UpstreamResult.absent();
            }
            outcome = "failed";
            log.warn("{} failed ({}): {}", operation, e.getKind(), e.getMessage());
            return UpstreamResult.failed(e.getKind(), e.getMessage());
        } finally {
            sample.stop(Timer.builder("upstream.latency")
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private JsonNode fetchWithFallback(String operation, URI uri) {
        try {
            return rateLimiter.call(() -> apiClient.getJson(uri, RiotApiClient.Encoding.GZIP));
        } catch (UpstreamException e) {
            if (e.getKind() != UpstreamFailureKind.MALFORMED_RESPONSE) {
                throw e;
            }
            fallbacks.increment();
            log.warn("{} returned a malformed response, retrying once without compression: {}",
                    operation, e.getMessage());
            return rateLimiter.call(() -> apiClient.getJson(uri, RiotApiClient.Encoding.IDENTITY));
        }
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(element -> {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            });
        }
        return values;
    }

    private static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(values::add);
        }
        return values;
    }
}
