package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.analysis.LaneMatchup;
import com.riftinsight.domain.analysis.TimelineAnalyzer;
import com.riftinsight.domain.model.LaneLeadResult;
import com.riftinsight.domain.model.LaneLeadSample;
import com.riftinsight.domain.model.TimelinePoint;
import com.riftinsight.infrastructure.riot.RegionRouting;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Average gold/xp lead over the lane opponent at a fixed minute, across the
 * player's recent matches.
 *
 * Flow:
 * 1. For each match (concurrently): find the lane opponent, fetch the timeline,
 *    take the point nearest the target minute
 * 2. Every pipeline ends in an {@link Outcome}: a sample or a skip reason
 * 3. Skips are counted and dropped, samples are averaged
 *
 * A failing match never fails the aggregate; with no samples the result is (0, 0, 0).
 */
@Slf4j
@Service
public class LaneLeadAggregator {

    public static final int MAX_MATCHES = 21;
    public static final double DEFAULT_TARGET_MINUTE = 14.0;

    private final UpstreamGateway gateway;
    private final TimelineAnalyzer timelineAnalyzer;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public LaneLeadAggregator(
            UpstreamGateway gateway,
            TimelineAnalyzer timelineAnalyzer,
            @Qualifier("laneLeadExecutor") Executor executor,
            MeterRegistry meterRegistry) {
        this.gateway = gateway;
        this.timelineAnalyzer = timelineAnalyzer;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public LaneLeadResult aggregate(String puuid, String region, List<JsonNode> recentMatches) {
        return aggregate(puuid, region, recentMatches, DEFAULT_TARGET_MINUTE);
    }

    /**
     * @param recentMatches match documents, newest first; only the first {@value #MAX_MATCHES} are used
     */
    public LaneLeadResult aggregate(String puuid, String region, List<JsonNode> recentMatches, double targetMinute) {
        if (recentMatches == null || recentMatches.isEmpty()) {
            return LaneLeadResult.EMPTY;
        }
        String routing = RegionRouting.regionalRouting(region);
        List<JsonNode> matches = recentMatches.subList(0, Math.min(MAX_MATCHES, recentMatches.size()));

        List<CompletableFuture<Outcome>> pipelines = new ArrayList<>(matches.size());
        for (JsonNode match : matches) {
            pipelines.add(CompletableFuture
                    .supplyAsync(() -> evaluate(match, puuid, routing, targetMinute), executor)
                    .exceptionally(ex -> Outcome.skip("error: " + rootMessage(ex))));
        }

        List<LaneLeadSample> samples = new ArrayList<>();
        for (CompletableFuture<Outcome> pipeline : pipelines) {
            Outcome outcome = pipeline.join();
            if (outcome.isSample()) {
                samples.add(outcome.getSample());
            } else {
                meterRegistry.counter("lane_leads.skipped").increment();
                log.debug("Lane lead skipped: {}", outcome.getSkipReason());
            }
        }

        LaneLeadResult result = LaneLeadResult.reduce(samples);
        log.info("Lane leads @{}m: gold={} xp={} from {}/{} matches",
                targetMinute, result.getAvgGoldLead(), result.getAvgXpLead(),
                result.getSampleSize(), matches.size());
        return result;
    }

    Outcome evaluate(JsonNode match, String puuid, String routing, double targetMinute) {
        Optional<LaneMatchup> matchup = LaneMatchup.find(match, puuid);
        if (matchup.isEmpty()) {
            return Outcome.skip("no lane opponent");
        }
        String matchId = match.path("metadata").path("matchId").asText("");
        if (matchId.isEmpty()) {
            return Outcome.skip("missing match id");
        }

        UpstreamResult<JsonNode> timeline = gateway.matchTimeline(routing, matchId);
        if (!timeline.isFound()) {
            return Outcome.skip(matchId + ": timeline " + timeline);
        }

        List<TimelinePoint> points = timelineAnalyzer.series(timeline.orElse(null),
                matchup.get().getSubjectParticipantId(), matchup.get().getOpponentParticipantId());
        Optional<TimelinePoint> closest = TimelineAnalyzer.closestPoint(points, targetMinute);
        if (closest.isEmpty()) {
            return Outcome.skip(matchId + ": no timeline points");
        }

        double gold = closest.get().getLaneGoldDelta();
        double xp = closest.get().getLaneXpDelta();
        if (!Double.isFinite(gold) || !Double.isFinite(xp)) {
            return Outcome.skip(matchId + ": non-finite lead");
        }
        return Outcome.sample(new LaneLeadSample(gold, xp));
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /**
     * Result of one per-match pipeline.
     */
    static final class Outcome {

        private final LaneLeadSample sample;
        private final String skipReason;

        private Outcome(LaneLeadSample sample, String skipReason) {
            this.sample = sample;
            this.skipReason = skipReason;
        }

        static Outcome sample(LaneLeadSample sample) {
            return new Outcome(sample, null);
        }

        static Outcome skip(String reason) {
            return new Outcome(null, reason);
        }

        boolean isSample() {
            return sample != null;
        }

        LaneLeadSample getSample() {
            return sample;
        }

        String getSkipReason() {
            return skipReason;
        }
    }
}
