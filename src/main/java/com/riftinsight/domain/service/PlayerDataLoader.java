package com.riftinsight.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riftinsight.domain.analysis.ParticipantFeatures;
import com.riftinsight.domain.scoring.PlayerMatchFrame;
import com.riftinsight.infrastructure.persistence.entity.MatchEntity;
import com.riftinsight.infrastructure.persistence.entity.ParticipantEntity;
import com.riftinsight.infrastructure.persistence.repository.MatchRepository;
import com.riftinsight.infrastructure.persistence.repository.ParticipantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the match store: the feature table used for scoring and the
 * raw match documents used by timeline-based analyses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerDataLoader {

    public static final int HISTORY_LIMIT = 50;

    private final ParticipantRepository participantRepository;
    private final MatchRepository matchRepository;
    private final ObjectMapper objectMapper;

    /**
     * Feature rows for the player's latest {@value #HISTORY_LIMIT} stored matches, newest first.
     */
    @Transactional(readOnly = true)
    public PlayerMatchFrame loadPlayerData(String puuid) {
        List<ParticipantEntity> participations = participantRepository
                .findByPuuidOrderByGameCreationDesc(puuid, PageRequest.of(0, HISTORY_LIMIT));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (ParticipantEntity participation : participations) {
            try {
                JsonNode stats = objectMapper.readTree(participation.getStatsJson());
                rows.add(ParticipantFeatures.extract(
                        stats, participation.getGameDuration(), participation.getGameCreation()));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable stats for match {}: {}", participation.getMatchId(), e.getMessage());
            }
        }
        log.debug("Loaded {} matches for {}", rows.size(), abbreviate(puuid));
        return new PlayerMatchFrame(rows);
    }

    /**
     * Stored match-v5 documents the player took part in, newest first.
     */
    @Transactional(readOnly = true)
    public List<JsonNode> recentMatchDocuments(String puuid, int limit) {
        List<JsonNode> documents = new ArrayList<>();
        for (MatchEntity match : matchRepository.findRecentByPuuid(puuid, PageRequest.of(0, Math.max(1, limit)))) {
            try {
                documents.add(objectMapper.readTree(match.getData()));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable document for match {}: {}", match.getMatchId(), e.getMessage());
            }
        }
        return documents;
    }

    public Optional<JsonNode> latestMatchDocument(String puuid) {
        return recentMatchDocuments(puuid, 1).stream().findFirst();
    }

    static String abbreviate(String puuid) {
        return puuid == null || puuid.length() <= 8 ? puuid : puuid.substring(0, 8) + "...";
    }
}
