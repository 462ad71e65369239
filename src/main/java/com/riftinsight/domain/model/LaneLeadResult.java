package com.riftinsight.domain.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mean lane leads over the surviving samples. No samples means (0.0, 0.0, 0).
 */
@Value
public class LaneLeadResult {

    public static final LaneLeadResult EMPTY = new LaneLeadResult(0.0, 0.0, 0);

    double avgGoldLead;
    double avgXpLead;
    int sampleSize;

    public static LaneLeadResult reduce(List<LaneLeadSample> samples) {
        if (samples.isEmpty()) {
            return EMPTY;
        }
        double gold = 0.0;
        double xp = 0.0;
        for (LaneLeadSample sample : samples) {
            gold += sample.getGoldLead();
            xp += sample.getXpLead();
        }
        return new LaneLeadResult(gold / samples.size(), xp / samples.size(), samples.size());
    }

    /**
     * Keys merged into the weighted averages of the result payload.
     */
    public Map<String, Object> toWeightedAverageEntries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("laneGoldLeadAt14", avgGoldLead);
        entries.put("laneXpLeadAt14", avgXpLead);
        entries.put("laneLeadSampleSize", sampleSize);
        return entries;
    }
}
