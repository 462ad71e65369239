package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.analysis.LaneMatchup;
import com.riftinsight.domain.analysis.TimelineAnalyzer;
import com.riftinsight.infrastructure.riot.RegionRouting;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Territorial control over the player's most recent matches.
 * Matches whose timeline cannot be fetched are left out; no usable match gives an empty map.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TerritoryService {

    static final int MATCH_LIMIT = 5;

    private final PlayerDataLoader playerDataLoader;
    private final UpstreamGateway gateway;
    private final TimelineAnalyzer timelineAnalyzer;

    public Map<String, Object> analyzeRecentMatches(String puuid, String region) {
        List<JsonNode> matches = playerDataLoader.recentMatchDocuments(puuid, MATCH_LIMIT);
        if (matches.isEmpty()) {
            log.info("No matches found for territory analysis");
            return Map.of();
        }
        String routing = RegionRouting.regionalRouting(region);

        List<Map<String, Object>> perMatch = new ArrayList<>();
        for (JsonNode match : matches) {
            Optional<JsonNode> participant = LaneMatchup.findParticipant(match, puuid);
            String matchId = match.path("metadata").path("matchId").asText("");
            if (participant.isEmpty() || matchId.isEmpty()) {
                continue;
            }
            UpstreamResult<JsonNode> timeline = gateway.matchTimeline(routing, matchId);
            if (!timeline.isFound()) {
                log.warn("Territory: no timeline for {} ({})", matchId, timeline);
                continue;
            }
            perMatch.add(timelineAnalyzer.territory(timeline.orElse(null),
                    participant.get().path("participantId").asInt(1),
                    participant.get().path("teamId").asInt(100)));
        }

        if (perMatch.isEmpty()) {
            return Map.of();
        }
        return timelineAnalyzer.aggregateTerritory(perMatch);
    }
}
