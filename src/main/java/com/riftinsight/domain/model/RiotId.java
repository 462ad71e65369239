package com.riftinsight.domain.model;

import com.riftinsight.domain.exception.InvalidRiotIdException;
import lombok.Value;

/**
 * Public player identity: display name and tag separated by '#'.
 */
@Value
public class RiotId {

    String gameName;
    String tagLine;

    /**
     * Split on the first '#'. Both parts must be non-blank.
     */
    public static RiotId parse(String raw) {
        if (raw == null || raw.indexOf('#') < 0) {
            throw new InvalidRiotIdException("Invalid Riot ID format");
        }
        int separator = raw.indexOf('#');
        String gameName = raw.substring(0, separator).trim();
        String tagLine = raw.substring(separator + 1).trim();
        if (gameName.isEmpty() || tagLine.isEmpty()) {
            throw new InvalidRiotIdException("Invalid Riot ID format");
        }
        return new RiotId(gameName, tagLine);
    }

    @Override
    public String toString() {
        return gameName + "#" + tagLine;
    }
}
