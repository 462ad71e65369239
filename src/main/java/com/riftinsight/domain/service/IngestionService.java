package com.riftinsight.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.model.IngestionProgress;
import com.riftinsight.infrastructure.persistence.entity.SummonerEntity;
import com.riftinsight.infrastructure.persistence.repository.MatchRepository;
import com.riftinsight.infrastructure.persistence.repository.SummonerRepository;
import com.riftinsight.infrastructure.riot.RegionRouting;
import com.riftinsight.infrastructure.riot.UpstreamException;
import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Write side of the match store.
 *
 * Ingestion Flow:
 * 1. Resolve Riot ID to PUUID (account-v1), then summoner profile (summoner-v4)
 * 2. Upsert the summoner row
 * 3. List the latest ranked solo match ids
 * 4. Fetch and store each match not stored yet, reporting progress per match
 *
 * Failure Handling:
 * - Unknown player: empty result, the caller reports "User not found"
 * - Failed identity or match-id lookup: {@link UpstreamException}, ends the analysis
 * - Failed single match fetch: match skipped, ingestion continues
 * - Match stored concurrently by another analysis: counted as already analyzed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    public static final int DEFAULT_MATCH_COUNT = 20;

    private final UpstreamGateway gateway;
    private final SummonerRepository summonerRepository;
    private final MatchRepository matchRepository;
    private final MatchStore matchStore;

    /**
     * Resolve the player and refresh their stored profile.
     *
     * @return empty when the Riot ID or summoner does not exist on the region
     * @throws UpstreamException when a lookup failed after retries
     */
    public Optional<SummonerEntity> getOrUpdateUser(String region, String gameName, String tagLine) {
        String platform = RegionRouting.normalizePlatform(region);

        Optional<JsonNode> account = gateway
                .accountByRiotId(RegionRouting.accountRouting(platform), gameName, tagLine)
                .orElseThrowFailure();
        if (account.isEmpty() || account.get().path("puuid").asText("").isEmpty()) {
            log.info("Account not found: {}#{} ({})", gameName, tagLine, platform);
            return Optional.empty();
        }
        String puuid = account.get().path("puuid").asText();

        Optional<JsonNode> summoner = gateway.summonerByPuuid(platform, puuid).orElseThrowFailure();
        if (summoner.isEmpty()) {
            log.info("No summoner on {} for {}#{}", platform, gameName, tagLine);
            return Optional.empty();
        }

        SummonerEntity entity = summonerRepository.findById(puuid)
                .orElseGet(() -> SummonerEntity.builder().puuid(puuid).build());
        entity.setGameName(account.get().path("gameName").asText(gameName));
        entity.setTagLine(account.get().path("tagLine").asText(tagLine));
        entity.setRegion(platform);
        entity.setProfileIconId(summoner.get().path("profileIconId").asInt(0));
        entity.setSummonerLevel(summoner.get().path("summonerLevel").asLong(0));
        return Optional.of(summonerRepository.save(entity));
    }

    /**
     * Store the player's latest ranked solo matches.
     *
     * @param listener receives one progress tuple per match id
     * @return number of newly stored matches
     */
    public int ingestMatchHistory(SummonerEntity user, int count, Consumer<IngestionProgress> listener) {
        String routing = RegionRouting.regionalRouting(user.getRegion());
        List<String> matchIds = gateway
                .matchHistoryIds(routing, user.getPuuid(), count, UpstreamGateway.RANKED_SOLO_QUEUE)
                .orElseThrowFailure()
                .orElse(List.of());

        int total = matchIds.size();
        if (total == 0) {
            listener.accept(new IngestionProgress(0, 0, "No ranked matches found"));
            return 0;
        }

        int stored = 0;
        for (int i = 0; i < total; i++) {
            String matchId = matchIds.get(i);
            int current = i + 1;
            if (matchRepository.existsById(matchId)) {
                listener.accept(new IngestionProgress(current, total,
                        "Match " + current + "/" + total + " already analyzed"));
                continue;
            }

            UpstreamResult<JsonNode> details = gateway.matchDetails(routing, matchId);
            if (details.isFound()) {
                try {
                    matchStore.store(matchId, details.orElse(null));
                    stored++;
                } catch (DataIntegrityViolationException e) {
                    log.info("Match {} was stored by a concurrent analysis", matchId);
                    listener.accept(new IngestionProgress(current, total,
                            "Match " + current + "/" + total + " already analyzed"));
                    continue;
                }
            } else {
                log.warn("Skipping match {}: {}", matchId, details);
            }
            listener.accept(new IngestionProgress(current, total,
                    "Ingesting match " + current + "/" + total));
        }
        log.info("Ingested {} new matches for {}", stored, PlayerDataLoader.abbreviate(user.getPuuid()));
        return stored;
    }
}
