package com.riftinsight.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.Value;

import java.util.Optional;

/**
 * The subject and their lane opponent (same role, other team) in one match document.
 */
@Value
public class LaneMatchup {

    JsonNode subject;
    JsonNode opponent;
    int subjectParticipantId;
    int opponentParticipantId;

    /**
     * Empty when the subject is missing, has no role (ARAM, arena) or nobody on the
     * other team shares their role.
     */
    public static Optional<LaneMatchup> find(JsonNode match, String puuid) {
        Optional<JsonNode> found = findParticipant(match, puuid);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        JsonNode me = found.get();
        int myTeam = me.path("teamId").asInt(0);
        String myRole = me.path("teamPosition").asText("");
        int myId = me.path("participantId").asInt(0);
        if (myTeam == 0 || myRole.isBlank() || myId == 0) {
            return Optional.empty();
        }

        for (JsonNode candidate : participants(match)) {
            if (candidate.path("teamId").asInt(0) != myTeam
                    && myRole.equals(candidate.path("teamPosition").asText(""))) {
                int opponentId = candidate.path("participantId").asInt(0);
                if (opponentId == 0) {
                    return Optional.empty();
                }
                return Optional.of(new LaneMatchup(me, candidate, myId, opponentId));
            }
        }
        return Optional.empty();
    }

    public static Optional<JsonNode> findParticipant(JsonNode match, String puuid) {
        for (JsonNode participant : participants(match)) {
            if (puuid.equals(participant.path("puuid").asText(null))) {
                return Optional.of(participant);
            }
        }
        return Optional.empty();
    }

    static JsonNode participants(JsonNode match) {
        return match == null ? MissingNode.getInstance()
                : match.path("info").path("participants");
    }
}
