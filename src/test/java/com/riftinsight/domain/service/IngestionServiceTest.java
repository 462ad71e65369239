package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riftinsight.domain.model.IngestionProgress;
import com.riftinsight.infrastructure.persistence.entity.SummonerEntity;
import com.riftinsight.infrastructure.persistence.repository.MatchRepository;
import com.riftinsight.infrastructure.persistence.repository.SummonerRepository;
import com.riftinsight.infrastructure.riot.UpstreamException;
import com.riftinsight.infrastructure.riot.UpstreamFailureKind;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestionService.
 */
@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private UpstreamGateway gateway;
    @Mock
    private SummonerRepository summonerRepository;
    @Mock
    private MatchRepository matchRepository;
    @Mock
    private MatchStore matchStore;

    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new IngestionService(gateway, summonerRepository, matchRepository, matchStore);
    }

    @Test
    void testGetOrUpdateUser_ResolvesAndSaves() {
        // Given
        JsonNode account = MAPPER.createObjectNode()
                .put("puuid", "p-1").put("gameName", "Faker").put("tagLine", "KR1");
        JsonNode summoner = MAPPER.createObjectNode()
                .put("profileIconId", 6).put("summonerLevel", 700);
        when(gateway.accountByRiotId("asia", "faker", "kr1")).thenReturn(UpstreamResult.found(account));
        when(gateway.summonerByPuuid("kr", "p-1")).thenReturn(UpstreamResult.found(summoner));
        when(summonerRepository.findById("p-1")).thenReturn(Optional.empty());
        when(summonerRepository.save(any(SummonerEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Optional<SummonerEntity> user = ingestionService.getOrUpdateUser("KR", "faker", "kr1");

        // Then
        assertTrue(user.isPresent());
        assertEquals("Faker", user.get().getGameName());
        assertEquals("KR1", user.get().getTagLine());
        assertEquals("kr", user.get().getRegion());
        assertEquals(700, user.get().getSummonerLevel());
    }

    @Test
    void testGetOrUpdateUser_AbsentAccountIsEmpty() {
        // Given
        when(gateway.accountByRiotId("europe", "Nobody", "EUW")).thenReturn(UpstreamResult.absent());

        // When
        Optional<SummonerEntity> user = ingestionService.getOrUpdateUser("euw1", "Nobody", "EUW");

        // Then
        assertTrue(user.isEmpty());
        verifyNoInteractions(summonerRepository);
    }

    @Test
    void testGetOrUpdateUser_FailedLookupThrows() {
        // Given
        when(gateway.accountByRiotId("europe", "Name", "EUW"))
                .thenReturn(UpstreamResult.failed(UpstreamFailureKind.RATE_LIMITED, "Rate limited"));

        // When / Then
        UpstreamException e = assertThrows(UpstreamException.class,
                () -> ingestionService.getOrUpdateUser("euw1", "Name", "EUW"));
        assertEquals(UpstreamFailureKind.RATE_LIMITED, e.getKind());
    }

    @Test
    void testIngestMatchHistory_SkipsKnownAndFailedMatches() {
        // Given
        SummonerEntity user = SummonerEntity.builder().puuid("p-1").region("euw1").build();
        when(gateway.matchHistoryIds("europe", "p-1", 3, UpstreamGateway.RANKED_SOLO_QUEUE))
                .thenReturn(UpstreamResult.found(List.of("EUW1_1", "EUW1_2", "EUW1_3")));
        when(matchRepository.existsById("EUW1_1")).thenReturn(true);
        when(matchRepository.existsById("EUW1_2")).thenReturn(false);
        when(matchRepository.existsById("EUW1_3")).thenReturn(false);
        when(gateway.matchDetails("europe", "EUW1_2")).thenReturn(UpstreamResult.found(matchDocument("EUW1_2")));
        when(gateway.matchDetails("europe", "EUW1_3"))
                .thenReturn(UpstreamResult.failed(UpstreamFailureKind.TRANSIENT, "503"));
        List<IngestionProgress> progress = new ArrayList<>();

        // When
        int stored = ingestionService.ingestMatchHistory(user, 3, progress::add);

        // Then
        assertEquals(1, stored);
        assertEquals(3, progress.size());
        assertEquals(1, progress.get(0).getCurrent());
        assertEquals(3, progress.get(2).getTotal());

        verify(matchStore).store(eq("EUW1_2"), any(JsonNode.class));
        verify(matchStore, never()).store(eq("EUW1_1"), any());
        verify(matchStore, never()).store(eq("EUW1_3"), any());
    }

    @Test
    void testIngestMatchHistory_NoMatchesReportsOnce() {
        // Given
        SummonerEntity user = SummonerEntity.builder().puuid("p-1").region("na1").build();
        when(gateway.matchHistoryIds("americas", "p-1", 20, UpstreamGateway.RANKED_SOLO_QUEUE))
                .thenReturn(UpstreamResult.found(List.of()));
        List<IngestionProgress> progress = new ArrayList<>();

        // When
        int stored = ingestionService.ingestMatchHistory(user, 20, progress::add);

        // Then
        assertEquals(0, stored);
        assertEquals(1, progress.size());
        assertEquals(0, progress.get(0).getTotal());
        verifyNoInteractions(matchRepository, matchStore);
    }

    @Test
    void testIngestMatchHistory_ConcurrentlyStoredMatchCountsAsAnalyzed() {
        // Given
        SummonerEntity user = SummonerEntity.builder().puuid("p-1").region("euw1").build();
        when(gateway.matchHistoryIds("europe", "p-1", 2, UpstreamGateway.RANKED_SOLO_QUEUE))
                .thenReturn(UpstreamResult.found(List.of("EUW1_1", "EUW1_2")));
        when(gateway.matchDetails(eq("europe"), anyString()))
                .thenAnswer(invocation -> UpstreamResult.found(matchDocument(invocation.getArgument(1))));
        when(matchStore.store(eq("EUW1_1"), any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));
        when(matchStore.store(eq("EUW1_2"), any())).thenReturn(2);
        List<IngestionProgress> progress = new ArrayList<>();

        // When
        int stored = ingestionService.ingestMatchHistory(user, 2, progress::add);

        // Then
        assertEquals(1, stored);
        assertEquals(2, progress.size());
        assertEquals("Match 1/2 already analyzed", progress.get(0).getStatus());
        assertEquals("Ingesting match 2/2", progress.get(1).getStatus());
    }

    @Test
    void testIngestMatchHistory_StoreFailurePropagates() {
        // Given
        SummonerEntity user = SummonerEntity.builder().puuid("p-1").region("euw1").build();
        when(gateway.matchHistoryIds("europe", "p-1", 1, UpstreamGateway.RANKED_SOLO_QUEUE))
                .thenReturn(UpstreamResult.found(List.of("EUW1_1")));
        when(gateway.matchDetails("europe", "EUW1_1")).thenReturn(UpstreamResult.found(matchDocument("EUW1_1")));
        when(matchStore.store(eq("EUW1_1"), any())).thenThrow(new IllegalStateException("connection lost"));

        // When / Then
        assertThrows(IllegalStateException.class,
                () -> ingestionService.ingestMatchHistory(user, 1, progress -> { }));
    }

        static JsonNode matchDocument(String matchId) {
        ObjectNode match = MAPPER.createObjectNode();
        match.putObject("metadata").put("matchId", matchId);
        ObjectNode info = match.putObject("info");
        info.put("gameCreation", 1_700_000_000_000L).put("gameDuration", 1900).put("queueId", 420);
        ArrayNode participants = info.putArray("participants");
        participants.addObject()
                .put("puuid", "p-1").put("participantId", 1).put("teamId", 100)
                .put("teamPosition", "MIDDLE").put("championName", "Ahri").put("win", true);
        participants.addObject()
                .put("puuid", "p-2").put("participantId", 6).put("teamId", 200)
                .put("teamPosition", "MIDDLE").put("championName", "Zed").put("win", false);
        return match;
    }
}
