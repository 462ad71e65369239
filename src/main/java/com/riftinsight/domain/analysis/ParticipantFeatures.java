package com.riftinsight.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the per-match feature row of one participant from a match-v5
 * participant object. The same keys are used for the subject's history and
 * for the lane opponent, so the two can be compared directly.
 */
public final class ParticipantFeatures {

    private static final String[] PINGS = {
        "enemyMissingPings", "onMyWayPings", "assistMePings", "getBackPings", "allInPings",
        "commandPings", "pushPings", "visionClearedPings", "needVisionPings", "holdPings"
    };

    private ParticipantFeatures() {
    }

    /**
     * @param gameDurationSeconds match length; values below one minute count as one minute
     */
    public static Map<String, Object> extract(JsonNode p, long gameDurationSeconds, long gameCreation) {
        JsonNode challenges = p.path("challenges");
        double minutes = Math.max(1.0, gameDurationSeconds / 60.0);
        double kills = p.path("kills").asDouble(0);
        double deaths = p.path("deaths").asDouble(0);
        double assists = p.path("assists").asDouble(0);
        double cs = p.path("totalMinionsKilled").asDouble(0) + p.path("neutralMinionsKilled").asDouble(0);
        double visionScore = p.path("visionScore").asDouble(0);
        double soloKills = challenges.path("soloKills").asDouble(0);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("win", p.path("win").asBoolean(false) ? 1 : 0);
        row.put("gameCreation", gameCreation);
        row.put("championName", p.path("championName").asText(""));
        row.put("teamPosition", p.path("teamPosition").asText(""));

        // Combat
        row.put("kills", kills);
        row.put("deaths", deaths);
        row.put("assists", assists);
        row.put("kda", (kills + assists) / Math.max(1.0, deaths));
        row.put("soloKills", soloKills);
        row.put("killParticipation", challenges.path("killParticipation").asDouble(0));
        row.put("teamDamagePercentage", challenges.path("teamDamagePercentage").asDouble(0));
        row.put("damageTakenOnTeamPercentage", challenges.path("damageTakenOnTeamPercentage").asDouble(0));
        row.put("damageDealtToChampions", p.path("totalDamageDealtToChampions").asDouble(0));
        row.put("damagePerMinute", p.path("totalDamageDealtToChampions").asDouble(0) / minutes);
        row.put("towerDamageDealt", p.path("damageDealtToTurrets").asDouble(0));

        // Economy
        row.put("totalMinionsKilled", cs);
        row.put("csPerMinute", cs / minutes);
        row.put("goldPerMinute", p.path("goldEarned").asDouble(0) / minutes);
        row.put("xpPerMinute", p.path("champExperience").asDouble(0) / minutes);
        row.put("laneMinionsFirst10Minutes", challenges.path("laneMinionsFirst10Minutes").asDouble(0));
        row.put("turretPlatesTaken", challenges.path("turretPlatesTaken").asDouble(0));

        // Vision
        row.put("visionScore", visionScore);
        row.put("wardsPlaced", p.path("wardsPlaced").asDouble(0));
        row.put("controlWardsPlaced", p.path("detectorWardsPlaced").asDouble(0));
        row.put("visionDominance", challenges.path("visionScoreAdvantageLaneOpponent").asDouble(0));

        // Laning
        row.put("earlyLaningPhaseGoldExpAdvantage", challenges.path("earlyLaningPhaseGoldExpAdvantage").asDouble(0));
        row.put("laningPhaseGoldExpAdvantage", challenges.path("laningPhaseGoldExpAdvantage").asDouble(0));
        row.put("maxCsAdvantageOnLaneOpponent", challenges.path("maxCsAdvantageOnLaneOpponent").asDouble(0));
        row.put("maxLevelLeadLaneOpponent", challenges.path("maxLevelLeadLaneOpponent").asDouble(0));
        row.put("skillshotsHit", challenges.path("skillshotsHit").asDouble(0));
        row.put("skillshotsDodged", challenges.path("skillshotsDodged").asDouble(0));

        // Derived tendencies
        row.put("aggressionScore", (kills + soloKills) / minutes);
        row.put("jungleInvasionPressure", challenges.path("enemyJungleMonsterKills").asDouble(0) / minutes);

        // Pings
        for (String ping : PINGS) {
            row.put(ping, p.path(ping).asDouble(0));
        }
        return row;
    }
}
