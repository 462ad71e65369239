package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riftinsight.domain.analysis.TimelineAnalyzer;
import com.riftinsight.domain.exception.ClientDisconnectedException;
import com.riftinsight.domain.model.AnalysisStage;
import com.riftinsight.domain.model.IngestionProgress;
import com.riftinsight.domain.model.LaneLeadResult;
import com.riftinsight.domain.model.ProgressEvent;
import com.riftinsight.domain.model.RateLimiterStats;
import com.riftinsight.domain.model.RiotId;
import com.riftinsight.domain.scoring.PlayerMatchFrame;
import com.riftinsight.domain.scoring.PlayerModel;
import com.riftinsight.domain.scoring.TrainingResult;
import com.riftinsight.infrastructure.persistence.entity.SummonerEntity;
import com.riftinsight.infrastructure.riot.UpstreamException;
import com.riftinsight.infrastructure.riot.UpstreamFailureKind;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalysisStreamService.
 *
 * Collaborators are mocked; the admission queue is real with a single slot and
 * a short poll interval so queue behavior can be observed quickly.
 */
@ExtendWith(MockitoExtension.class)
class AnalysisStreamServiceTest {

    static final String PUUID = "puuid-123";
    static final RiotId RIOT_ID = RiotId.parse("Name#EUW");

    @Mock
    private UpstreamGateway gateway;
    @Mock
    private IngestionService ingestionService;
    @Mock
    private PlayerDataLoader playerDataLoader;
    @Mock
    private PlayerModel playerModel;
    @Mock
    private LaneLeadAggregator laneLeadAggregator;
    @Mock
    private TerritoryService territoryService;
    @Mock
    private StaticDataService staticDataService;

    private AdmissionQueue admissionQueue;
    private ExecutorService waitExecutor;
    private AnalysisStreamService service;
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final ProgressSink sink = events::add;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        admissionQueue = new AdmissionQueue(1, meterRegistry);
        waitExecutor = Executors.newCachedThreadPool();
        service = new AnalysisStreamService(admissionQueue, gateway, ingestionService, playerDataLoader,
                playerModel, laneLeadAggregator, territoryService, new TimelineAnalyzer(), staticDataService,
                waitExecutor, Duration.ofMillis(20), meterRegistry);
        lenient().when(gateway.limits()).thenReturn(new RateLimiterStats(5, 0, 0));
    }

    @AfterEach
    void tearDown() {
        waitExecutor.shutdownNow();
    }

    @Test
    void testAnalyze_HappyPathEmitsOrderedStagesAndOneResult() {
        // Given
        SummonerEntity user = stubUserAndIngestion();
        PlayerMatchFrame frame = frame(6);
        TrainingResult trained = TrainingResult.builder()
                .metrics(Map.of("sampleSize", 6))
                .features(Map.of())
                .build();
        Map<String, Object> averages = new HashMap<>();
        averages.put("kda", 3.0);
        averages.put("visionDominance", Double.NaN);

        when(playerDataLoader.loadPlayerData(PUUID)).thenReturn(frame);
        when(playerModel.train(frame)).thenReturn(trained);
        when(playerModel.calculateWeightedAverages(frame)).thenReturn(averages);
        when(playerDataLoader.recentMatchDocuments(PUUID, 6)).thenReturn(List.of());
        when(laneLeadAggregator.aggregate(eq(PUUID), eq("euw1"), anyList()))
                .thenReturn(new LaneLeadResult(120.0, 80.0, 4));
        when(playerModel.predictWinProbability(eq(trained), anyMap())).thenReturn(60.0);
        when(territoryService.analyzeRecentMatches(PUUID, "euw1")).thenReturn(Map.of("ownHalfRatio", 0.5));
        when(staticDataService.currentVersion()).thenReturn("14.24.1");

        // When
        service.analyze(RIOT_ID, "EUW1", sink);

        // Then
        List<String> stages = events.stream()
                .filter(e -> ProgressEvent.TYPE_PROGRESS.equals(e.getType()))
                .map(ProgressEvent::getStage)
                .distinct()
                .collect(Collectors.toList());
        assertEquals(List.of("FIND_ACCOUNT", "FETCH_RANKED", "MATCH_HISTORY", "LOAD_MATCH_DATA", "TRAIN_MODEL",
                "PERFORMANCE_METRICS", "LANE_LEADS", "MOOD", "TERRITORIAL", "WIN_PROB", "OPPONENT_COMPARE",
                "WIN_FACTORS", "FETCH_TIMELINE", "PREPARE_RESULTS"), stages);
        assertPercentsNonDecreasing();
        assertSingleTerminalAtEnd();

        ProgressEvent result = events.get(events.size() - 1);
        assertEquals(ProgressEvent.TYPE_RESULT, result.getType());
        Map<String, Object> data = result.getData();
        assertEquals("success", data.get("status"));
        assertEquals("14.24.1", data.get("ddragon_version"));
        assertEquals(6, data.get("total_matches"));

        // 0.7 * 50 (3 wins of 6) + 0.3 * 60
        assertEquals(53.0, (Double) data.get("win_probability"), 1e-9);

        @SuppressWarnings("unchecked")
        Map<String, Object> userView = (Map<String, Object>) data.get("user");
        assertEquals("Name", userView.get("game_name"));
        assertEquals(PUUID, userView.get("puuid"));

        @SuppressWarnings("unchecked")
        Map<String, Object> weighted = (Map<String, Object>) data.get("weighted_averages");
        assertEquals(120.0, weighted.get("laneGoldLeadAt14"));
        assertEquals(4, weighted.get("laneLeadSampleSize"));
        assertTrue(weighted.containsKey("visionDominance"));
        assertNull(weighted.get("visionDominance"));

        @SuppressWarnings("unchecked")
        Map<String, Object> ranked = (Map<String, Object>) data.get("ranked_data");
        assertEquals("GOLD", ranked.get("tier"));
        assertEquals(42, ranked.get("lp"));

        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_MatchHistoryProgressMapsToTenToSeventy() {
        // Given
        stubUserAndIngestion();
        when(playerDataLoader.loadPlayerData(PUUID)).thenReturn(PlayerMatchFrame.empty());
        when(playerModel.train(any())).thenReturn(TrainingResult.degraded("Not enough matches"));

        // When
        service.analyze(RIOT_ID, "euw1", sink);

        // Then
        List<Integer> historyPercents = events.stream()
                .filter(e -> "MATCH_HISTORY".equals(e.getStage()))
                .map(ProgressEvent::getPercent)
                .collect(Collectors.toList());
        assertEquals(List.of(10, 40, 70), historyPercents);
        assertTrue(events.get(1).getLimits() != null && events.get(1).getQueue() != null);
    }

    @Test
    void testAnalyze_QueueFullEmitsQueuedBeforeFindAccount() throws Exception {
        // Given
        AdmissionQueue.Slot held = admissionQueue.acquire(new AdmissionQueue.Waiter());
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW")).thenReturn(Optional.empty());
        ExecutorService streamThread = Executors.newSingleThreadExecutor();

        try {
            // When
            Future<?> stream = streamThread.submit(() -> service.analyze(RIOT_ID, "euw1", sink));
            AdmissionQueueTest.waitUntil(() -> events.stream().anyMatch(e -> "QUEUED".equals(e.getStage())));
            assertTrue(events.stream().noneMatch(e -> "FIND_ACCOUNT".equals(e.getStage())));
            held.close();
            stream.get(5, TimeUnit.SECONDS);
        } finally {
            streamThread.shutdownNow();
        }

        // Then
        ProgressEvent queued = events.get(0);
        assertEquals("QUEUED", queued.getStage());
        assertEquals(0, queued.getPercent());
        assertTrue(queued.getQueuePosition() >= 1);
        assertNotNull(queued.getQueue());
        assertEquals(1, queued.getQueue().getActive());

        int lastQueued = -1;
        int findAccount = -1;
        for (int i = 0; i < events.size(); i++) {
            if ("QUEUED".equals(events.get(i).getStage())) {
                lastQueued = i;
            } else if ("FIND_ACCOUNT".equals(events.get(i).getStage()) && findAccount < 0) {
                findAccount = i;
            }
        }
        assertTrue(lastQueued < findAccount);
        assertSingleTerminalAtEnd();
        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_SlotFreedBeforeFirstPollStillReportsQueued() throws Exception {
        // Given
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        AnalysisStreamService slowPolling = new AnalysisStreamService(admissionQueue, gateway, ingestionService,
                playerDataLoader, playerModel, laneLeadAggregator, territoryService, new TimelineAnalyzer(),
                staticDataService, waitExecutor, Duration.ofMillis(1500), meterRegistry);
        AdmissionQueue.Slot held = admissionQueue.acquire(new AdmissionQueue.Waiter());
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW")).thenReturn(Optional.empty());
        ExecutorService streamThread = Executors.newSingleThreadExecutor();

        try {
            // When
            Future<?> stream = streamThread.submit(() -> slowPolling.analyze(RIOT_ID, "euw1", sink));
            AdmissionQueueTest.waitUntil(() -> admissionQueue.stats().getQueued() == 1);
            Thread.sleep(300);
            held.close();
            stream.get(5, TimeUnit.SECONDS);
        } finally {
            streamThread.shutdownNow();
        }

        // Then
        List<String> stages = events.stream()
                .map(e -> e.getStage() == null ? e.getType() : e.getStage())
                .collect(Collectors.toList());
        assertEquals(List.of("QUEUED", "FIND_ACCOUNT", "error"), stages);
        assertEquals(1, events.get(0).getQueuePosition());
        assertEquals(0, admissionQueue.stats().getActive());
        assertEquals(0, admissionQueue.stats().getQueued());
    }

    @Test
    void testAnalyze_FreeSlotEmitsNoQueuedEvent() {
        // Given
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW")).thenReturn(Optional.empty());

        // When
        service.analyze(RIOT_ID, "euw1", sink);

        // Then
        assertTrue(events.stream().noneMatch(e -> "QUEUED".equals(e.getStage())));
        assertEquals("FIND_ACCOUNT", events.get(0).getStage());
    }

    @Test
    void testAnalyze_WaitExecutorSaturatedEndsWithErrorAndLeavesNoWaiter() throws Exception {
        // Given
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        AnalysisStreamService saturated = new AnalysisStreamService(admissionQueue, gateway, ingestionService,
                playerDataLoader, playerModel, laneLeadAggregator, territoryService, new TimelineAnalyzer(),
                staticDataService, task -> {
                    throw new RejectedExecutionException("wait pool full");
                }, Duration.ofMillis(20), meterRegistry);
        AdmissionQueue.Slot held = admissionQueue.acquire(new AdmissionQueue.Waiter());

        // When
        saturated.analyze(RIOT_ID, "euw1", sink);
        held.close();

        // Then
        assertEquals(1, events.size());
        assertEquals(ProgressEvent.TYPE_ERROR, events.get(0).getType());
        assertTrue(events.get(0).getMessage().startsWith("Server error"));
        assertEquals(0, admissionQueue.stats().getQueued());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void testAnalyze_UserNotFound() {
        // Given
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW")).thenReturn(Optional.empty());

        // When
        service.analyze(RIOT_ID, "euw", sink);

        // Then
        assertEquals(2, events.size());
        assertEquals("FIND_ACCOUNT", events.get(0).getStage());
        assertEquals(ProgressEvent.TYPE_ERROR, events.get(1).getType());
        assertEquals("User not found", events.get(1).getMessage());
        verify(ingestionService, never()).ingestMatchHistory(any(), anyInt(), any());
        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_DegradedTrainingReturnsPartialResult() {
        // Given
        stubUserAndIngestion();
        PlayerMatchFrame frame = frame(3);
        when(playerDataLoader.loadPlayerData(PUUID)).thenReturn(frame);
        when(playerModel.train(frame)).thenReturn(TrainingResult.degraded("Need at least 5 matches"));

        // When
        service.analyze(RIOT_ID, "euw1", sink);

        // Then
        assertSingleTerminalAtEnd();
        ProgressEvent result = events.get(events.size() - 1);
        assertEquals(ProgressEvent.TYPE_RESULT, result.getType());
        assertEquals("partial", result.getData().get("status"));
        assertEquals("Need at least 5 matches", result.getData().get("message"));
        assertEquals(50.0, result.getData().get("win_probability"));
        verifyNoInteractions(laneLeadAggregator, territoryService);
        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_UpstreamFailureDuringIdentityEndsWithError() {
        // Given
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW"))
                .thenThrow(new UpstreamException(UpstreamFailureKind.TRANSIENT, "Upstream error (503)"));

        // When
        service.analyze(RIOT_ID, "euw1", sink);

        // Then
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ProgressEvent.TYPE_ERROR, last.getType());
        assertEquals("Upstream error (503)", last.getMessage());
        assertSingleTerminalAtEnd();
        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_UnexpectedFailureBecomesServerError() {
        // Given
        stubUserAndIngestion();
        when(playerDataLoader.loadPlayerData(PUUID)).thenThrow(new IllegalStateException("db down"));

        // When
        service.analyze(RIOT_ID, "euw1", sink);

        // Then
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ProgressEvent.TYPE_ERROR, last.getType());
        assertEquals("Server error: db down", last.getMessage());
        assertSingleTerminalAtEnd();
        assertEquals(0, admissionQueue.stats().getActive());
    }

    @Test
    void testAnalyze_ClientDisconnectStopsAndReleasesSlot() {
        // Given
        ProgressSink broken = event -> {
            throw new ClientDisconnectedException("Broken pipe", null);
        };

        // When
        service.analyze(RIOT_ID, "euw1", broken);

        // Then
        verify(ingestionService, never()).getOrUpdateUser(anyString(), anyString(), anyString());
        assertEquals(0, admissionQueue.stats().getActive());
        assertEquals(0, admissionQueue.stats().getQueued());
    }

    private SummonerEntity stubUserAndIngestion() {
        SummonerEntity user = SummonerEntity.builder()
                .puuid(PUUID).gameName("Name").tagLine("EUW").region("euw1")
                .profileIconId(29).summonerLevel(250)
                .build();
        when(ingestionService.getOrUpdateUser("euw1", "Name", "EUW")).thenReturn(Optional.of(user));

        ObjectNode entry = new ObjectMapper().createObjectNode()
                .put("queueType", "RANKED_SOLO_5x5").put("tier", "GOLD").put("rank", "II")
                .put("leaguePoints", 42).put("wins", 30).put("losses", 25);
        when(gateway.leagueEntries("euw1", PUUID)).thenReturn(UpstreamResult.<List<JsonNode>>found(List.of(entry)));

        when(ingestionService.ingestMatchHistory(eq(user), eq(20), any())).thenAnswer(invocation -> {
            Consumer<IngestionProgress> listener = invocation.getArgument(2);
            listener.accept(new IngestionProgress(1, 2, "Ingesting match 1/2"));
            listener.accept(new IngestionProgress(2, 2, "Ingesting match 2/2"));
            return 2;
        });
        return user;
    }

    private static PlayerMatchFrame frame(int matches) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < matches; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("win", i % 2 == 0 ? 1 : 0);
            row.put("gameCreation", 1_700_000_000_000L - i * 3_600_000L);
            row.put("kda", 2.0 + i);
            rows.add(row);
        }
        return new PlayerMatchFrame(rows);
    }

    private void assertPercentsNonDecreasing() {
        int previous = 0;
        for (ProgressEvent event : events) {
            if (!ProgressEvent.TYPE_PROGRESS.equals(event.getType())
                    || AnalysisStage.QUEUED.name().equals(event.getStage())) {
                continue;
            }
            assertTrue(event.getPercent() >= previous,
                    "percent went from " + previous + " to " + event.getPercent() + " at " + event.getStage());
            assertTrue(event.getPercent() <= 100);
            previous = event.getPercent();
        }
    }

    private void assertSingleTerminalAtEnd() {
        long terminals = events.stream().filter(ProgressEvent::isTerminal).count();
        assertEquals(1, terminals);
        assertTrue(events.get(events.size() - 1).isTerminal());
    }
}
