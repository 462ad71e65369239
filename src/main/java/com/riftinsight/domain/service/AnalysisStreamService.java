package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.analysis.LaneMatchup;
import com.riftinsight.domain.analysis.ParticipantFeatures;
import com.riftinsight.domain.analysis.ResultSanitizer;
import com.riftinsight.domain.analysis.TimelineAnalyzer;
import com.riftinsight.domain.exception.ClientDisconnectedException;
import com.riftinsight.domain.model.AnalysisStage;
import com.riftinsight.domain.model.LaneLeadResult;
import com.riftinsight.domain.model.ProgressEvent;
import com.riftinsight.domain.model.RiotId;
import com.riftinsight.domain.model.TimelinePoint;
import com.riftinsight.domain.scoring.PlayerMatchFrame;
import com.riftinsight.domain.scoring.PlayerModel;
import com.riftinsight.domain.scoring.TrainingResult;
import com.riftinsight.infrastructure.persistence.entity.SummonerEntity;
import com.riftinsight.infrastructure.riot.RegionRouting;
import com.riftinsight.infrastructure.riot.UpstreamException;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one player analysis and reports it as a stream of progress events.
 *
 * Stream Flow:
 * 1. QUEUED (repeated while waiting for an analysis slot)
 * 2. FIND_ACCOUNT, FETCH_RANKED, MATCH_HISTORY (once per ingested match)
 * 3. LOAD_MATCH_DATA, TRAIN_MODEL (degraded training ends with a partial result)
 * 4. PERFORMANCE_METRICS, LANE_LEADS, MOOD, TERRITORIAL, WIN_PROB,
 *    OPPONENT_COMPARE, WIN_FACTORS, FETCH_TIMELINE, PREPARE_RESULTS
 * 5. Exactly one result or error event
 *
 * Slot handling:
 * - The blocking acquire runs on the admission wait executor; this thread only
 *   does timed waits on it and reports the queue position between them
 * - Every exit path closes the slot through the pending acquire, so a slot
 *   granted after the client left is released as soon as it arrives
 *
 * Degraded phases (ranked data, lane leads, territory, timeline) are logged and
 * left empty. Identity resolution and ingestion failures end the stream with an error.
 */
@Slf4j
@Service
public class AnalysisStreamService {

    static final int MATCH_HISTORY_COUNT = IngestionService.DEFAULT_MATCH_COUNT;
    static final int MATCH_HISTORY_SPAN = 60;
    static final double RECENT_WIN_RATE_WEIGHT = 0.7;
    static final double MODEL_WEIGHT = 0.3;
    static final List<String> TREND_COLUMNS = List.of(
            "kda", "visionScore", "killParticipation", "win", "gameCreation", "aggressionScore",
            "visionDominance", "jungleInvasionPressure", "goldPerMinute", "damagePerMinute");

    private final AdmissionQueue admissionQueue;
    private final UpstreamGateway gateway;
    private final IngestionService ingestionService;
    private final PlayerDataLoader playerDataLoader;
    private final PlayerModel playerModel;
    private final LaneLeadAggregator laneLeadAggregator;
    private final TerritoryService territoryService;
    private final TimelineAnalyzer timelineAnalyzer;
    private final StaticDataService staticDataService;
    private final Executor admissionWaitExecutor;
    private final Duration pollInterval;
    private final MeterRegistry meterRegistry;

    public AnalysisStreamService(
            AdmissionQueue admissionQueue,
            UpstreamGateway gateway,
            IngestionService ingestionService,
            PlayerDataLoader playerDataLoader,
            PlayerModel playerModel,
            LaneLeadAggregator laneLeadAggregator,
            TerritoryService territoryService,
            TimelineAnalyzer timelineAnalyzer,
            StaticDataService staticDataService,
            @Qualifier("admissionWaitExecutor") Executor admissionWaitExecutor,
            @Value("${app.analysis.queue-poll-interval:1500ms}") Duration pollInterval,
            MeterRegistry meterRegistry) {
        this.admissionQueue = admissionQueue;
        this.gateway = gateway;
        this.ingestionService = ingestionService;
        this.playerDataLoader = playerDataLoader;
        this.playerModel = playerModel;
        this.laneLeadAggregator = laneLeadAggregator;
        this.territoryService = territoryService;
        this.timelineAnalyzer = timelineAnalyzer;
        this.staticDataService = staticDataService;
        this.admissionWaitExecutor = admissionWaitExecutor;
        this.pollInterval = pollInterval;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run the whole analysis on the calling thread, writing events to the sink.
     * Returns once a terminal event was written or the client went away.
     */
    public void analyze(RiotId riotId, String region, ProgressSink sink) {
        String platform = RegionRouting.normalizePlatform(region);
        Emitter emitter = new Emitter(sink);
        AdmissionQueue.Waiter waiter = new AdmissionQueue.Waiter();
        CompletableFuture<AdmissionQueue.Slot> pending = new CompletableFuture<>();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";

        try {
            requestSlot(waiter, pending);
            awaitSlot(pending, waiter, emitter);
            log.info("Analysis started: {} ({})", riotId, platform);
            outcome = run(riotId, platform, emitter);
        } catch (ClientDisconnectedException e) {
            outcome = "disconnected";
            log.info("Client disconnected during analysis of {}: {}", riotId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = "interrupted";
            log.info("Analysis of {} interrupted", riotId);
        } catch (Exception e) {
            log.error("Analysis failed for {}: {}", riotId, e.getMessage(), e);
            emitter.terminal(ProgressEvent.error("Server error: " + e.getMessage()));
        } finally {
            pending.thenAccept(AdmissionQueue.Slot::close);
            sample.stop(meterRegistry.timer("analysis.duration", "outcome", outcome));
            log.info("Analysis finished: {} ({})", riotId, outcome);
        }
    }

    /**
     * Completes {@code pending} with a slot. A free slot is taken on this thread;
     * otherwise the waiter is registered here, so its position is visible before
     * the first poll, and the blocking acquire runs on the wait executor.
     */
    private void requestSlot(AdmissionQueue.Waiter waiter, CompletableFuture<AdmissionQueue.Slot> pending)
            throws InterruptedException {
        Optional<AdmissionQueue.Slot> free = admissionQueue.tryAcquire();
        if (free.isPresent()) {
            pending.complete(free.get());
            return;
        }
        admissionQueue.register(waiter);
        try {
            admissionWaitExecutor.execute(() -> {
                try {
                    pending.complete(admissionQueue.acquire(waiter));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pending.completeExceptionally(e);
                } catch (RuntimeException e) {
                    pending.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            admissionQueue.withdraw(waiter);
            log.warn("Too many analyses waiting, rejecting request");
            pending.completeExceptionally(e);
        }
    }

    /**
     * Reports the queue position once before waiting and again on every poll
     * interval that passes without a slot.
     */
    private void awaitSlot(CompletableFuture<AdmissionQueue.Slot> pending, AdmissionQueue.Waiter waiter,
                           Emitter emitter) throws InterruptedException, ExecutionException {
        if (!pending.isDone()) {
            reportPosition(waiter, emitter);
        }
        while (true) {
            try {
                pending.get(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                reportPosition(waiter, emitter);
            }
        }
    }

    private void reportPosition(AdmissionQueue.Waiter waiter, Emitter emitter) {
        int position = admissionQueue.position(waiter);
        if (position > 0) {
            emitter.queued(position);
        }
    }

    private String run(RiotId riotId, String platform, Emitter emitter) {
        emitter.progress(AnalysisStage.FIND_ACCOUNT);
        String ddragonVersion = staticDataService.currentVersion();

        SummonerEntity user;
        Map<String, Object> rankedData;
        try {
            Optional<SummonerEntity> found = ingestionService.getOrUpdateUser(
                    platform, riotId.getGameName(), riotId.getTagLine());
            if (found.isEmpty()) {
                emitter.terminal(ProgressEvent.error("User not found"));
                return "not_found";
            }
            user = found.get();

            emitter.progress(AnalysisStage.FETCH_RANKED);
            rankedData = rankedSoloEntry(platform, user.getPuuid());

            emitter.progress(AnalysisStage.MATCH_HISTORY);
            ingestionService.ingestMatchHistory(user, MATCH_HISTORY_COUNT, progress -> {
                double percent = progress.getTotal() > 0
                        ? AnalysisStage.MATCH_HISTORY.getPercent()
                          + Math.floor((double) progress.getCurrent() / progress.getTotal() * MATCH_HISTORY_SPAN)
                        : AnalysisStage.MATCH_HISTORY.getPercent();
                emitter.progress(AnalysisStage.MATCH_HISTORY, progress.getStatus(), percent);
            });
        } catch (UpstreamException e) {
            log.warn("Ingestion failed for {}: {}", riotId, e.getMessage());
            emitter.terminal(ProgressEvent.error(e.getMessage()));
            return "upstream_error";
        }

        emitter.progress(AnalysisStage.LOAD_MATCH_DATA);
        PlayerMatchFrame frame = playerDataLoader.loadPlayerData(user.getPuuid());

        emitter.progress(AnalysisStage.TRAIN_MODEL);
        TrainingResult trained = playerModel.train(frame);
        if (trained.isDegraded()) {
            emitter.terminal(ProgressEvent.result(ResultSanitizer.sanitizeMap(partialResult(user, trained))));
            return "partial";
        }

        emitter.progress(AnalysisStage.PERFORMANCE_METRICS);
        Map<String, Object> weightedAverages = new LinkedHashMap<>(playerModel.calculateWeightedAverages(frame));

        int laneLeadLimit = Math.min(frame.size(), LaneLeadAggregator.MAX_MATCHES);
        if (laneLeadLimit <= 0) {
            laneLeadLimit = LaneLeadAggregator.MAX_MATCHES;
        }
        emitter.progress(AnalysisStage.LANE_LEADS,
                "Computing lane leads @14m (last " + laneLeadLimit + " matches)...",
                AnalysisStage.LANE_LEADS.getPercent());
        weightedAverages.putAll(laneLeads(user, laneLeadLimit).toWeightedAverageEntries());

        Map<String, Object> lastMatchStats = frame.isEmpty() ? new LinkedHashMap<>() : frame.latest();
        Optional<JsonNode> lastMatch = playerDataLoader.latestMatchDocument(user.getPuuid());

        emitter.progress(AnalysisStage.MOOD);
        List<Map<String, Object>> playerMoods = playerModel.analyzePlayerMood(frame);
        double winRate = frame.winRate();

        emitter.progress(AnalysisStage.TERRITORIAL);
        Map<String, Object> territoryMetrics = territory(user);

        emitter.progress(AnalysisStage.WIN_PROB);
        double modelPrediction = playerModel.predictWinProbability(trained, lastMatchStats);
        double winProbability = winRate * RECENT_WIN_RATE_WEIGHT + modelPrediction * MODEL_WEIGHT;

        emitter.progress(AnalysisStage.OPPONENT_COMPARE);
        Optional<LaneMatchup> matchup = lastMatch.flatMap(match -> LaneMatchup.find(match, user.getPuuid()));
        Map<String, Object> enemyStats = matchup
                .map(m -> opponentStats(m, lastMatch.get()))
                .orElseGet(LinkedHashMap::new);

        emitter.progress(AnalysisStage.WIN_FACTORS);
        List<Map<String, Object>> winDrivers = playerModel.getWinDriverInsights(trained, frame, lastMatchStats, enemyStats);
        List<Map<String, Object>> skillFocus = playerModel.getSkillFocus(frame, lastMatchStats, enemyStats);

        emitter.progress(AnalysisStage.FETCH_TIMELINE);
        Map<String, Object> timelineSeries = new LinkedHashMap<>();
        Map<String, Object> heatmapData = null;
        if (lastMatch.isPresent()) {
            Integer opponentId = matchup.map(LaneMatchup::getOpponentParticipantId).orElse(null);
            heatmapData = timelineSection(user, lastMatch.get(), opponentId, lastMatchStats, timelineSeries);
        }

        emitter.progress(AnalysisStage.PREPARE_RESULTS);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("user", userView(user));
        result.put("metrics", trained.getMetrics());
        result.put("win_probability", winProbability);
        result.put("player_moods", playerMoods);
        result.put("weighted_averages", weightedAverages);
        result.put("last_match_stats", lastMatchStats);
        result.put("enemy_stats", enemyStats);
        result.put("win_drivers", winDrivers);
        result.put("skill_focus", skillFocus);
        result.put("match_timeline_series", timelineSeries);
        result.put("performance_trends", frame.select(TREND_COLUMNS));
        result.put("win_rate", winRate);
        result.put("total_matches", frame.size());
        result.put("territory_metrics", territoryMetrics);
        result.put("ranked_data", rankedData);
        result.put("ddragon_version", ddragonVersion);
        result.put("heatmap_data", heatmapData);

        emitter.terminal(ProgressEvent.result(ResultSanitizer.sanitizeMap(result)));
        return "success";
    }

    private Map<String, Object> rankedSoloEntry(String platform, String puuid) {
        UpstreamResult<List<JsonNode>> entries = gateway.leagueEntries(platform, puuid);
        if (entries.isFailed()) {
            log.warn("Ranked data unavailable: {}", entries);
            return null;
        }
        for (JsonNode entry : entries.orElse(List.of())) {
            if ("RANKED_SOLO_5x5".equals(entry.path("queueType").asText())) {
                Map<String, Object> ranked = new LinkedHashMap<>();
                ranked.put("tier", entry.path("tier").asText("UNRANKED"));
                ranked.put("rank", entry.path("rank").asText(""));
                ranked.put("lp", entry.path("leaguePoints").asInt(0));
                ranked.put("wins", entry.path("wins").asInt(0));
                ranked.put("losses", entry.path("losses").asInt(0));
                ranked.put("hotStreak", entry.path("hotStreak").asBoolean(false));
                ranked.put("veteran", entry.path("veteran").asBoolean(false));
                ranked.put("freshBlood", entry.path("freshBlood").asBoolean(false));
                return ranked;
            }
        }
        return null;
    }

    private LaneLeadResult laneLeads(SummonerEntity user, int limit) {
        try {
            List<JsonNode> matches = playerDataLoader.recentMatchDocuments(user.getPuuid(), limit);
            return laneLeadAggregator.aggregate(user.getPuuid(), user.getRegion(), matches);
        } catch (RuntimeException e) {
            log.warn("Lane lead aggregation failed: {}", e.getMessage());
            return LaneLeadResult.EMPTY;
        }
    }

    private Map<String, Object> territory(SummonerEntity user) {
        try {
            return territoryService.analyzeRecentMatches(user.getPuuid(), user.getRegion());
        } catch (RuntimeException e) {
            log.warn("Territory analysis failed: {}", e.getMessage());
            return Map.of();
        }
    }

    private static Map<String, Object> opponentStats(LaneMatchup matchup, JsonNode match) {
        JsonNode info = match.path("info");
        Map<String, Object> stats = ParticipantFeatures.extract(matchup.getOpponent(),
                info.path("gameDuration").asLong(0), info.path("gameCreation").asLong(0));
        stats.put("championName", matchup.getOpponent().path("championName").asText("Opponent"));
        return stats;
    }

    /**
     * Fills the timeline series, patches missing laning advantage stats from it
     * and returns heatmap data. Any failure leaves the section empty.
     */
    private Map<String, Object> timelineSection(SummonerEntity user, JsonNode match, Integer opponentId,
                                                Map<String, Object> lastMatchStats,
                                                Map<String, Object> timelineSeries) {
        String matchId = match.path("metadata").path("matchId").asText("");
        Optional<JsonNode> me = LaneMatchup.findParticipant(match, user.getPuuid());
        if (matchId.isEmpty() || me.isEmpty()) {
            return null;
        }
        try {
            UpstreamResult<JsonNode> timeline = gateway.matchTimeline(
                    RegionRouting.regionalRouting(user.getRegion()), matchId);
            if (!timeline.isFound()) {
                log.warn("No timeline for last match {}: {}", matchId, timeline);
                return null;
            }
            JsonNode timelineDoc = timeline.orElse(null);
            int participantId = me.get().path("participantId").asInt(0);
            if (participantId > 0) {
                List<TimelinePoint> points = timelineAnalyzer.series(timelineDoc, participantId, opponentId);
                timelineSeries.put("timeline", points);
                if (opponentId != null) {
                    patchAdvantage(lastMatchStats, points, 8, "earlyLaningPhaseGoldExpAdvantage");
                    patchAdvantage(lastMatchStats, points, 14, "laningPhaseGoldExpAdvantage");
                }
            }
            return timelineDoc == null ? null : timelineAnalyzer.heatmap(timelineDoc, match);
        } catch (RuntimeException e) {
            log.warn("Timeline section failed for {}: {}", matchId, e.getMessage());
            return null;
        }
    }

    // Only fills values the match document left missing or zero.
    static void patchAdvantage(Map<String, Object> stats, List<TimelinePoint> points, int minute, String key) {
        Object current = stats.get(key);
        double value = current instanceof Number ? ((Number) current).doubleValue() : 0.0;
        if (value != 0.0) {
            return;
        }
        TimelineAnalyzer.closestPoint(points, minute)
                .ifPresent(p -> stats.put(key, p.getLaneGoldDelta() + p.getLaneXpDelta()));
    }

    private static Map<String, Object> partialResult(SummonerEntity user, TrainingResult trained) {
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put("status", "partial");
        partial.put("message", trained.getError());
        partial.put("user", userView(user));
        partial.put("metrics", Map.of());
        partial.put("player_moods", List.of());
        partial.put("weighted_averages", Map.of());
        partial.put("win_drivers", List.of());
        partial.put("skill_focus", List.of());
        partial.put("performance_trends", List.of());
        partial.put("win_probability", 50.0);
        return partial;
    }

    static Map<String, Object> userView(SummonerEntity user) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("game_name", user.getGameName());
        view.put("tag_line", user.getTagLine());
        view.put("region", user.getRegion());
        view.put("profile_icon_id", user.getProfileIconId());
        view.put("summoner_level", user.getSummonerLevel());
        view.put("puuid", user.getPuuid());
        return view;
    }

    /**
     * Per-stream writer. Keeps percents non-decreasing, attaches limiter and
     * queue stats, and lets only one terminal event through.
     */
    private final class Emitter {

        private final ProgressSink sink;
        private int lastPercent;
        private boolean terminated;

        private Emitter(ProgressSink sink) {
            this.sink = sink;
        }

        void queued(int position) {
            sink.send(ProgressEvent.queued(position, admissionQueue.stats()));
        }

        void progress(AnalysisStage stage) {
            progress(stage, stage.getMessage(), stage.getPercent());
        }

        void progress(AnalysisStage stage, String message, Object percent) {
            ProgressEvent event = ProgressEvent.progress(stage, message, percent);
            lastPercent = Math.max(lastPercent, event.getPercent());
            event.setPercent(lastPercent);
            try {
                event.setLimits(gateway.limits());
            } catch (RuntimeException e) {
                log.debug("Rate limiter stats unavailable: {}", e.getMessage());
            }
            try {
                event.setQueue(admissionQueue.stats());
            } catch (RuntimeException e) {
                log.debug("Queue stats unavailable: {}", e.getMessage());
            }
            sink.send(event);
        }

        void terminal(ProgressEvent event) {
            if (terminated) {
                return;
            }
            terminated = true;
            try {
                sink.send(event);
            } catch (ClientDisconnectedException e) {
                log.info("Client gone before {} event: {}", event.getType(), e.getMessage());
            }
        }
    }
}
