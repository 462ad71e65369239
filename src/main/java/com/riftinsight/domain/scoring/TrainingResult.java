package com.riftinsight.domain.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Output of {@link PlayerModel#train}. A degraded result carries an error message
 * and no feature statistics; the stream then returns a partial analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingResult {

    private String error;
    private Map<String, Object> metrics;

    /** Per-feature {winMean, lossMean, mean, std, weight}. */
    private Map<String, FeatureStats> features;

    public boolean isDegraded() {
        return error != null;
    }

    public static TrainingResult degraded(String error) {
        return TrainingResult.builder().error(error).metrics(Map.of()).features(Map.of()).build();
    }

    @Data
    @AllArgsConstructor
    public static class FeatureStats {
        private double winMean;
        private double lossMean;
        private double mean;
        private double std;
        private double weight;
    }
}
