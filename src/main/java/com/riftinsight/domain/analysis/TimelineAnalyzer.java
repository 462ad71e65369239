package com.riftinsight.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.riftinsight.domain.model.TimelinePoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives per-minute series, territorial control and heatmap data from match-v5
 * timeline documents.
 *
 * Timeline layout used here: info.frames[] with a millisecond timestamp,
 * participantFrames keyed "1".."10" (totalGold, xp, minionsKilled,
 * jungleMinionsKilled, position) and events[]. Participants 1-5 are team 100,
 * 6-10 team 200.
 */
@Component
public class TimelineAnalyzer {

    // Summoner's Rift runs from (0,0) at the blue fountain to about (14870,14870).
    static final double MAP_DIAGONAL = 14870.0;
    static final double RIVER_HALF_WIDTH = 1200.0;

    /**
     * One point per frame. Lane deltas are zero when there is no lane opponent.
     */
    public List<TimelinePoint> series(JsonNode timeline, int subjectId, Integer opponentId) {
        List<TimelinePoint> points = new ArrayList<>();
        boolean blueSide = subjectId <= 5;
        for (JsonNode frame : frames(timeline)) {
            JsonNode participantFrames = frame.path("participantFrames");
            if (!participantFrames.isObject()) {
                continue;
            }
            double teamGold = 0;
            double teamXp = 0;
            for (int id = 1; id <= 10; id++) {
                JsonNode pf = participantFrames.path(String.valueOf(id));
                double sign = (id <= 5) == blueSide ? 1 : -1;
                teamGold += sign * pf.path("totalGold").asDouble(0);
                teamXp += sign * pf.path("xp").asDouble(0);
            }

            JsonNode me = participantFrames.path(String.valueOf(subjectId));
            TimelinePoint.TimelinePointBuilder point = TimelinePoint.builder()
                    .minute(frame.path("timestamp").asDouble(0) / 60000.0)
                    .goldDelta(teamGold)
                    .xpDelta(teamXp);
            if (opponentId != null) {
                JsonNode enemy = participantFrames.path(String.valueOf(opponentId));
                point.laneGoldDelta(me.path("totalGold").asDouble(0) - enemy.path("totalGold").asDouble(0))
                        .laneXpDelta(me.path("xp").asDouble(0) - enemy.path("xp").asDouble(0))
                        .laneCsDelta(creepScore(me) - creepScore(enemy));
            }
            points.add(point.build());
        }
        return points;
    }

    /**
     * Point whose minute is nearest to the target. Ties keep the earlier point;
     * points with a non-finite minute are ignored.
     */
    public static Optional<TimelinePoint> closestPoint(List<TimelinePoint> points, double targetMinute) {
        TimelinePoint best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (TimelinePoint point : points) {
            if (point == null || !Double.isFinite(point.getMinute())) {
                continue;
            }
            double distance = Math.abs(point.getMinute() - targetMinute);
            if (distance < bestDistance) {
                best = point;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Share of frames the player spent on their own half, the enemy half and the river.
     * The opening frame (everyone in fountain) is skipped.
     */
    public Map<String, Object> territory(JsonNode timeline, int participantId, int teamId) {
        int own = 0;
        int enemy = 0;
        int river = 0;
        int counted = 0;
        boolean first = true;
        for (JsonNode frame : frames(timeline)) {
            if (first) {
                first = false;
                continue;
            }
            JsonNode position = frame.path("participantFrames").path(String.valueOf(participantId)).path("position");
            if (!position.has("x") || !position.has("y")) {
                continue;
            }
            double diagonal = position.path("x").asDouble() + position.path("y").asDouble();
            double offset = teamId == 200 ? MAP_DIAGONAL - diagonal : diagonal - MAP_DIAGONAL;
            if (Math.abs(offset) <= RIVER_HALF_WIDTH) {
                river++;
            } else if (offset < 0) {
                own++;
            } else {
                enemy++;
            }
            counted++;
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("ownHalfRatio", ratio(own, counted));
        metrics.put("enemyHalfRatio", ratio(enemy, counted));
        metrics.put("riverRatio", ratio(river, counted));
        metrics.put("framesAnalyzed", counted);
        return metrics;
    }

    /**
     * Averages numeric metrics across matches; adds matchesAnalyzed.
     */
    public Map<String, Object> aggregateTerritory(List<Map<String, Object>> perMatch) {
        Map<String, Object> aggregated = new LinkedHashMap<>();
        if (perMatch.isEmpty()) {
            return aggregated;
        }
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (Map<String, Object> metrics : perMatch) {
            metrics.forEach((key, value) -> {
                if (value instanceof Number) {
                    double[] acc = sums.computeIfAbsent(key, k -> new double[2]);
                    acc[0] += ((Number) value).doubleValue();
                    acc[1]++;
                }
            });
        }
        sums.forEach((key, acc) -> aggregated.put(key, acc[0] / acc[1]));
        aggregated.put("matchesAnalyzed", perMatch.size());
        return aggregated;
    }

    /**
     * Positions of every participant per frame plus kill and ward events.
     * Ward events carry no position upstream; the placer's position in the
     * same frame is used.
     */
    public Map<String, Object> heatmap(JsonNode timeline, JsonNode match) {
        Map<Integer, Map<String, Object>> participants = new LinkedHashMap<>();
        Map<Integer, List<Map<String, Object>>> positionsById = new LinkedHashMap<>();
        for (JsonNode p : LaneMatchup.participants(match)) {
            int id = p.path("participantId").asInt(0);
            if (id == 0) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("participantId", id);
            entry.put("championName", p.path("championName").asText("Unknown"));
            entry.put("teamId", p.path("teamId").asInt(0));
            List<Map<String, Object>> positions = new ArrayList<>();
            entry.put("positions", positions);
            participants.put(id, entry);
            positionsById.put(id, positions);
        }

        List<Map<String, Object>> kills = new ArrayList<>();
        List<Map<String, Object>> wards = new ArrayList<>();
        Map<Integer, Double> previousGold = new LinkedHashMap<>();

        for (JsonNode frame : frames(timeline)) {
            long timestamp = frame.path("timestamp").asLong(0);
            JsonNode participantFrames = frame.path("participantFrames");
            for (Map.Entry<Integer, List<Map<String, Object>>> entry : positionsById.entrySet()) {
                JsonNode pf = participantFrames.path(String.valueOf(entry.getKey()));
                JsonNode position = pf.path("position");
                if (!position.has("x")) {
                    continue;
                }
                double gold = pf.path("totalGold").asDouble(0);
                Map<String, Object> sample = new LinkedHashMap<>();
                sample.put("x", position.path("x").asDouble());
                sample.put("y", position.path("y").asDouble());
                sample.put("timestamp", timestamp);
                sample.put("totalGold", gold);
                sample.put("goldDelta", gold - previousGold.getOrDefault(entry.getKey(), gold));
                previousGold.put(entry.getKey(), gold);
                entry.getValue().add(sample);
            }

            for (JsonNode event : frame.path("events")) {
                String type = event.path("type").asText("");
                if ("CHAMPION_KILL".equals(type) && event.path("position").has("x")) {
                    Map<String, Object> kill = new LinkedHashMap<>();
                    kill.put("x", event.path("position").path("x").asDouble());
                    kill.put("y", event.path("position").path("y").asDouble());
                    kill.put("killerId", event.path("killerId").asInt(0));
                    kill.put("victimId", event.path("victimId").asInt(0));
                    List<Integer> assists = new ArrayList<>();
                    event.path("assistingParticipantIds").forEach(a -> assists.add(a.asInt()));
                    kill.put("assistingParticipantIds", assists);
                    kill.put("timestamp", event.path("timestamp").asLong(0));
                    kills.add(kill);
                } else if ("WARD_PLACED".equals(type)) {
                    int creatorId = event.path("creatorId").asInt(0);
                    JsonNode position = participantFrames.path(String.valueOf(creatorId)).path("position");
                    if (creatorId == 0 || !position.has("x")) {
                        continue;
                    }
                    Map<String, Object> ward = new LinkedHashMap<>();
                    ward.put("x", position.path("x").asDouble());
                    ward.put("y", position.path("y").asDouble());
                    ward.put("wardType", event.path("wardType").asText("UNDEFINED"));
                    ward.put("creatorId", creatorId);
                    ward.put("timestamp", event.path("timestamp").asLong(0));
                    wards.add(ward);
                }
            }
        }

        Map<String, Object> heatmap = new LinkedHashMap<>();
        heatmap.put("participants", new ArrayList<>(participants.values()));
        heatmap.put("kill_events", kills);
        heatmap.put("ward_events", wards);
        return heatmap;
    }

    private static JsonNode frames(JsonNode timeline) {
        return timeline.path("info").path("frames");
    }

    private static double creepScore(JsonNode participantFrame) {
        return participantFrame.path("minionsKilled").asDouble(0)
                + participantFrame.path("jungleMinionsKilled").asDouble(0);
    }

    private static double ratio(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
