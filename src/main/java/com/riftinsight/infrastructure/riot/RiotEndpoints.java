package com.riftinsight.infrastructure.riot;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Locale;

/**
 * URI templates for the Riot developer API and Data Dragon.
 *
 * Platform hosts (euw1, na1, ...) serve summoner and league lookups; regional
 * hosts (europe, americas, ...) serve account and match lookups.
 */
@Component
public class RiotEndpoints {

    private final String apiBaseUrl;
    private final String ddragonBaseUrl;

    public RiotEndpoints(
            @Value("${app.riot.api-base-url:https://{host}.api.riotgames.com}") String apiBaseUrl,
            @Value("${app.riot.ddragon-base-url:https://ddragon.leagueoflegends.com}") String ddragonBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
        this.ddragonBaseUrl = ddragonBaseUrl;
    }

    public URI accountByRiotId(String regionalRouting, String gameName, String tagLine) {
        return api(regionalRouting, "/riot/account/v1/accounts/by-riot-id/{gameName}/{tagLine}")
                .buildAndExpand(gameName, tagLine).encode().toUri();
    }

    public URI summonerByPuuid(String platformRegion, String puuid) {
        return api(platformRegion, "/lol/summoner/v4/summoners/by-puuid/{puuid}")
                .buildAndExpand(puuid).encode().toUri();
    }

    public URI matchIdsByPuuid(String regionalRouting, String puuid, int queue, int count) {
        return api(regionalRouting, "/lol/match/v5/matches/by-puuid/{puuid}/ids")
                .queryParam("queue", queue)
                .queryParam("count", count)
                .buildAndExpand(puuid).encode().toUri();
    }

    public URI match(String regionalRouting, String matchId) {
        return api(regionalRouting, "/lol/match/v5/matches/{matchId}")
                .buildAndExpand(matchId).encode().toUri();
    }

    public URI matchTimeline(String regionalRouting, String matchId) {
        return api(regionalRouting, "/lol/match/v5/matches/{matchId}/timeline")
                .buildAndExpand(matchId).encode().toUri();
    }

    public URI leagueEntriesByPuuid(String platformRegion, String puuid) {
        return api(platformRegion, "/lol/league/v4/entries/by-puuid/{puuid}")
                .buildAndExpand(puuid).encode().toUri();
    }

    public URI staticDataVersions() {
        return UriComponentsBuilder.fromHttpUrl(ddragonBaseUrl + "/api/versions.json").build().toUri();
    }

    /**
     * Data Dragon is public; the API key must not be sent there.
     */
    public boolean isStaticData(URI uri) {
        return uri.toString().startsWith(ddragonBaseUrl);
    }

    private UriComponentsBuilder api(String host, String path) {
        String base = apiBaseUrl.replace("{host}", host.toLowerCase(Locale.ROOT));
        return UriComponentsBuilder.fromHttpUrl(base + path);
    }
}
