package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.infrastructure.persistence.entity.MatchEntity;
import com.riftinsight.infrastructure.persistence.entity.ParticipantEntity;
import com.riftinsight.infrastructure.persistence.repository.MatchRepository;
import com.riftinsight.infrastructure.persistence.repository.ParticipantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Persists one match document together with its participant rows.
 *
 * The match row and the participant rows commit together or not at all. The
 * match row is flushed first, so a concurrent insert of the same match fails
 * with a DataIntegrityViolationException before any participant is written.
 */
@Component
@RequiredArgsConstructor
public class MatchStore {

    private final MatchRepository matchRepository;
    private final ParticipantRepository participantRepository;

    /**
     * @return number of participant rows written
     */
    @Transactional
    public int store(String matchId, JsonNode document) {
        JsonNode info = document.path("info");
        long gameCreation = info.path("gameCreation").asLong(0);
        long gameDuration = info.path("gameDuration").asLong(0);

        matchRepository.saveAndFlush(MatchEntity.builder()
                .matchId(matchId)
                .gameCreation(gameCreation)
                .gameDuration(gameDuration)
                .queueId(info.path("queueId").asInt(0))
                .data(document.toString())
                .build());

        List<ParticipantEntity> participants = new ArrayList<>();
        for (JsonNode p : info.path("participants")) {
            participants.add(ParticipantEntity.builder()
                    .matchId(matchId)
                    .puuid(p.path("puuid").asText(""))
                    .participantId(p.path("participantId").asInt(0))
                    .teamId(p.path("teamId").asInt(0))
                    .teamPosition(p.path("teamPosition").asText(""))
                    .championName(p.path("championName").asText(""))
                    .win(p.path("win").asBoolean(false))
                    .gameCreation(gameCreation)
                    .gameDuration(gameDuration)
                    .statsJson(p.toString())
                    .build());
        }
        participantRepository.saveAll(participants);
        return participants.size();
    }
}
