package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riftinsight.domain.analysis.TimelineAnalyzer;
import com.riftinsight.domain.model.LaneLeadResult;
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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LaneLeadAggregator.
 *
 * Match and timeline documents are built in the match-v5 shape with the
 * subject as participant 1 (blue) and the lane opponent as participant 6.
 */
@ExtendWith(MockitoExtension.class)
class LaneLeadAggregatorTest {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final String PUUID = "subject-puuid";

    @Mock
    private UpstreamGateway gateway;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private LaneLeadAggregator aggregator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new LaneLeadAggregator(gateway, new TimelineAnalyzer(), executor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testAggregate_AveragesSurvivingSamples() {
        // Given
        JsonNode first = match("EUW1_1", "MIDDLE", "MIDDLE");
        JsonNode second = match("EUW1_2", "MIDDLE", "MIDDLE");
        JsonNode noOpponent = match("EUW1_3", "MIDDLE", "TOP");

        when(gateway.matchTimeline("europe", "EUW1_1")).thenReturn(UpstreamResult.found(timeline(10, 5)));
        when(gateway.matchTimeline("europe", "EUW1_2")).thenReturn(UpstreamResult.found(timeline(-4, 2)));

        // When
        LaneLeadResult result = aggregator.aggregate(PUUID, "euw1", List.of(first, second, noOpponent));

        // Then
        assertEquals(2, result.getSampleSize());
        assertEquals(3.0, result.getAvgGoldLead(), 1e-9);
        assertEquals(3.5, result.getAvgXpLead(), 1e-9);
        verify(gateway, never()).matchTimeline(anyString(), eq("EUW1_3"));
        assertEquals(1.0, meterRegistry.counter("lane_leads.skipped").count());
    }

    @Test
    void testAggregate_EmptyMatchSetIsZeroNotError() {
        // When
        LaneLeadResult result = aggregator.aggregate(PUUID, "euw1", List.of());

        // Then
        assertEquals(0, result.getSampleSize());
        assertEquals(0.0, result.getAvgGoldLead());
        assertEquals(0.0, result.getAvgXpLead());
        verifyNoInteractions(gateway);
    }

    @Test
    void testAggregate_FailuresBecomeSkips() {
        // Given
        JsonNode ok = match("EUW1_1", "BOTTOM", "BOTTOM");
        JsonNode throwing = match("EUW1_2", "BOTTOM", "BOTTOM");
        JsonNode absent = match("EUW1_3", "BOTTOM", "BOTTOM");
        JsonNode failed = match("EUW1_4", "BOTTOM", "BOTTOM");

        when(gateway.matchTimeline("europe", "EUW1_1")).thenReturn(UpstreamResult.found(timeline(300, -120)));
        when(gateway.matchTimeline("europe", "EUW1_2")).thenThrow(new IllegalStateException("boom"));
        when(gateway.matchTimeline("europe", "EUW1_3")).thenReturn(UpstreamResult.absent());
        when(gateway.matchTimeline("europe", "EUW1_4"))
                .thenReturn(UpstreamResult.failed(UpstreamFailureKind.TRANSIENT, "503"));

        // When
        LaneLeadResult result = aggregator.aggregate(PUUID, "euw1", List.of(ok, throwing, absent, failed));

        // Then
        assertEquals(1, result.getSampleSize());
        assertEquals(300.0, result.getAvgGoldLead(), 1e-9);
        assertEquals(-120.0, result.getAvgXpLead(), 1e-9);
        assertEquals(3.0, meterRegistry.counter("lane_leads.skipped").count());
    }

    @Test
    void testAggregate_TimelineWithoutFramesIsSkipped() {
        // Given
        ObjectNode empty = MAPPER.createObjectNode();
        empty.putObject("info").putArray("frames");
        when(gateway.matchTimeline("americas", "NA1_1")).thenReturn(UpstreamResult.found(empty));

        // When
        LaneLeadResult result = aggregator.aggregate(PUUID, "na1", List.of(match("NA1_1", "TOP", "TOP")));

        // Then
        assertEquals(LaneLeadResult.EMPTY, result);
    }

    @Test
    void testAggregate_UsesAtMostTwentyOneMatches() {
        // Given
        List<JsonNode> matches = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            matches.add(match("EUW1_" + i, "JUNGLE", "JUNGLE"));
        }
        when(gateway.matchTimeline(eq("europe"), anyString())).thenReturn(UpstreamResult.found(timeline(50, 25)));

        // When
        LaneLeadResult result = aggregator.aggregate(PUUID, "euw1", matches);

        // Then
        assertEquals(LaneLeadAggregator.MAX_MATCHES, result.getSampleSize());
        verify(gateway, times(LaneLeadAggregator.MAX_MATCHES)).matchTimeline(eq("europe"), anyString());
        verify(gateway, never()).matchTimeline("europe", "EUW1_21");
    }

    static JsonNode match(String matchId, String subjectRole, String enemyRole) {
        ObjectNode match = MAPPER.createObjectNode();
        match.putObject("metadata").put("matchId", matchId);
        ObjectNode info = match.putObject("info");
        info.put("gameDuration", 1800);
        info.put("gameCreation", 1_700_000_000_000L);
        ArrayNode participants = info.putArray("participants");
        participants.addObject().put("puuid", PUUID).put("participantId", 1)
                .put("teamId", 100).put("teamPosition", subjectRole).put("championName", "Ahri");
        participants.addObject().put("puuid", "enemy-puuid").put("participantId", 6)
                .put("teamId", 200).put("teamPosition", enemyRole).put("championName", "Zed");
        return match;
    }

    /**
     * Frames at minutes 0, 10, 14 and 16; only minute 14 carries the given leads.
     */
    static JsonNode timeline(double goldLead, double xpLead) {
        ObjectNode timeline = MAPPER.createObjectNode();
        ArrayNode frames = timeline.putObject("info").putArray("frames");
        addFrame(frames, 0, 0, 0);
        addFrame(frames, 10, 999, 999);
        addFrame(frames, 14, goldLead, xpLead);
        addFrame(frames, 16, -999, -999);
        return timeline;
    }

    static void addFrame(ArrayNode frames, int minute, double goldLead, double xpLead) {
        ObjectNode frame = frames.addObject();
        frame.put("timestamp", minute * 60_000L);
        ObjectNode participantFrames = frame.putObject("participantFrames");
        double base = 500 + minute * 400;
        participantFrames.putObject("1").put("totalGold", base + goldLead).put("xp", base + xpLead);
        participantFrames.putObject("6").put("totalGold", base).put("xp", base);
        frame.putArray("events");
    }
}
