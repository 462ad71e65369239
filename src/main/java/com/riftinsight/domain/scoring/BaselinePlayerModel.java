package com.riftinsight.domain.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standardised mean-difference model.
 *
 * Training compares each feature's mean in wins against losses, scaled by the
 * feature's spread; the scaled difference is the feature weight. Prediction is a
 * logistic over the weighted z-scores of one match.
 */
@Slf4j
@Component
public class BaselinePlayerModel implements PlayerModel {

    static final int MIN_MATCHES = 5;
    static final int MOOD_WINDOW = 10;
    static final double RECENCY_DECAY = 0.9;

    static final List<String> FEATURES = List.of(
            "kda", "deaths", "visionScore", "goldPerMinute", "damagePerMinute", "xpPerMinute",
            "csPerMinute", "killParticipation", "teamDamagePercentage", "controlWardsPlaced",
            "soloKills", "laningPhaseGoldExpAdvantage");

    private static final List<String> MOOD_FEATURES = List.of("kda", "killParticipation", "goldPerMinute");

    private static final Map<String, String> TIPS = Map.of(
            "csPerMinute", "Focus on last hitting; aim for 7+ CS per minute.",
            "goldPerMinute", "Convert leads into plates and objectives to raise gold income.",
            "visionScore", "Buy control wards and clear vision before objectives.",
            "damagePerMinute", "Look for more trades and teamfight damage when ahead.",
            "xpPerMinute", "Avoid long roams that cost you lane experience.",
            "killParticipation", "Group with your team for skirmishes around objectives.");

    @Override
    public TrainingResult train(PlayerMatchFrame frame) {
        int n = frame.size();
        if (n < MIN_MATCHES) {
            return TrainingResult.degraded(
                    "Not enough ranked matches for analysis (found " + n + ", need " + MIN_MATCHES + ")");
        }
        long wins = frame.column(PlayerMatchFrame.WIN).stream().filter(w -> w >= 0.5).count();
        if (wins == 0 || wins == n) {
            return TrainingResult.degraded("Match history has only wins or only losses; win factors cannot be separated");
        }

        Map<String, TrainingResult.FeatureStats> features = new LinkedHashMap<>();
        for (String feature : FEATURES) {
            double winSum = 0;
            double lossSum = 0;
            int winCount = 0;
            int lossCount = 0;
            List<Double> all = new ArrayList<>();
            for (Map<String, Object> row : frame.rows()) {
                Double value = number(row.get(feature));
                Double win = number(row.get(PlayerMatchFrame.WIN));
                if (value == null || win == null) {
                    continue;
                }
                all.add(value);
                if (win >= 0.5) {
                    winSum += value;
                    winCount++;
                } else {
                    lossSum += value;
                    lossCount++;
                }
            }
            if (winCount == 0 || lossCount == 0) {
                continue;
            }
            double mean = all.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            double variance = all.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0);
            double std = variance > 0 ? Math.sqrt(variance) : 1.0;
            double winMean = winSum / winCount;
            double lossMean = lossSum / lossCount;
            features.put(feature, new TrainingResult.FeatureStats(
                    winMean, lossMean, mean, std, (winMean - lossMean) / std));
        }

        TrainingResult trained = TrainingResult.builder()
                .features(features)
                .metrics(new LinkedHashMap<>())
                .build();

        int correct = 0;
        for (Map<String, Object> row : frame.rows()) {
            boolean predictedWin = predictWinProbability(trained, row) >= 50.0;
            Double win = number(row.get(PlayerMatchFrame.WIN));
            if (win != null && predictedWin == (win >= 0.5)) {
                correct++;
            }
        }

        Map<String, Object> importance = new LinkedHashMap<>();
        features.entrySet().stream()
                .sorted(Comparator.comparingDouble(
                        (Map.Entry<String, TrainingResult.FeatureStats> e) -> -Math.abs(e.getValue().getWeight())))
                .forEach(e -> importance.put(e.getKey(), Math.abs(e.getValue().getWeight())));

        trained.getMetrics().put("sampleSize", n);
        trained.getMetrics().put("winRate", frame.winRate());
        trained.getMetrics().put("trainingAccuracy", (double) correct / n);
        trained.getMetrics().put("featureImportance", importance);

        log.debug("Trained baseline model on {} matches ({} features)", n, features.size());
        return trained;
    }

    @Override
    public double predictWinProbability(TrainingResult trained, Map<String, Object> matchStats) {
        if (trained == null || trained.isDegraded() || trained.getFeatures() == null
                || trained.getFeatures().isEmpty()) {
            return 50.0;
        }
        double score = 0;
        int used = 0;
        for (Map.Entry<String, TrainingResult.FeatureStats> entry : trained.getFeatures().entrySet()) {
            Double value = number(matchStats.get(entry.getKey()));
            if (value == null) {
                continue;
            }
            TrainingResult.FeatureStats stats = entry.getValue();
            score += stats.getWeight() * (value - stats.getMean()) / stats.getStd();
            used++;
        }
        if (used == 0) {
            return 50.0;
        }
        return 100.0 / (1.0 + Math.exp(-score / Math.sqrt(used)));
    }

    /**
     * Recency-weighted mean of every numeric column; newest match weighs most.
     */
    @Override
    public Map<String, Object> calculateWeightedAverages(PlayerMatchFrame frame) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        double weight = 1.0;
        for (Map<String, Object> row : frame.rows()) {
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                if (PlayerMatchFrame.GAME_CREATION.equals(cell.getKey())) {
                    continue;
                }
                Double value = number(cell.getValue());
                if (value == null) {
                    continue;
                }
                double[] acc = sums.computeIfAbsent(cell.getKey(), k -> new double[2]);
                acc[0] += weight * value;
                acc[1] += weight;
            }
            weight *= RECENCY_DECAY;
        }
        Map<String, Object> averages = new LinkedHashMap<>();
        sums.forEach((key, acc) -> averages.put(key, acc[0] / acc[1]));
        return averages;
    }

    @Override
    public List<Map<String, Object>> analyzePlayerMood(PlayerMatchFrame frame) {
        List<Map<String, Object>> moods = new ArrayList<>();
        List<Map<String, Object>> rows = frame.rows();
        for (int i = 0; i < Math.min(MOOD_WINDOW, rows.size()); i++) {
            Map<String, Object> row = rows.get(i);
            double z = 0;
            int used = 0;
            for (String feature : MOOD_FEATURES) {
                Double value = number(row.get(feature));
                List<Double> column = frame.column(feature);
                if (value == null || column.size() < 2) {
                    continue;
                }
                double mean = frame.mean(feature);
                double std = Math.sqrt(column.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0));
                z += std > 0 ? (value - mean) / std : 0;
                used++;
            }
            double score = used == 0 ? 0 : z / used;
            boolean win = number(row.get(PlayerMatchFrame.WIN)) != null && number(row.get(PlayerMatchFrame.WIN)) >= 0.5;

            String mood;
            if (win && score > 0.5) {
                mood = "confident";
            } else if (!win && score < -0.5) {
                mood = "tilted";
            } else if (!win && score >= 0) {
                mood = "unlucky";
            } else {
                mood = "steady";
            }

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(PlayerMatchFrame.GAME_CREATION, row.get(PlayerMatchFrame.GAME_CREATION));
            entry.put("mood", mood);
            entry.put("score", Math.round(score * 100.0) / 100.0);
            entry.put(PlayerMatchFrame.WIN, win);
            moods.add(entry);
        }
        return moods;
    }

    @Override
    public List<Map<String, Object>> getWinDriverInsights(TrainingResult trained, PlayerMatchFrame frame,
                                                          Map<String, Object> lastMatchStats,
                                                          Map<String, Object> enemyStats) {
        List<Map<String, Object>> drivers = new ArrayList<>();
        if (trained == null || trained.isDegraded() || trained.getFeatures() == null) {
            return drivers;
        }
        trained.getFeatures().entrySet().stream()
                .sorted(Comparator.comparingDouble(
                        (Map.Entry<String, TrainingResult.FeatureStats> e) -> -Math.abs(e.getValue().getWeight())))
                .limit(5)
                .forEach(e -> {
                    TrainingResult.FeatureStats stats = e.getValue();
                    Double yours = number(lastMatchStats.get(e.getKey()));
                    boolean higherIsBetter = stats.getWeight() >= 0;
                    Map<String, Object> driver = new LinkedHashMap<>();
                    driver.put("feature", e.getKey());
                    driver.put("impact", stats.getWeight());
                    driver.put("yourValue", yours);
                    driver.put("winAverage", stats.getWinMean());
                    driver.put("lossAverage", stats.getLossMean());
                    driver.put("opponentValue", number(enemyStats.get(e.getKey())));
                    driver.put("direction", higherIsBetter ? "higher_is_better" : "lower_is_better");
                    if (yours != null) {
                        boolean onTrack = higherIsBetter ? yours >= stats.getWinMean() : yours <= stats.getWinMean();
                        driver.put("status", onTrack ? "on_track" : "needs_work");
                    }
                    drivers.add(driver);
                });
        return drivers;
    }

    /**
     * Largest relative deficits of the last match against the lane opponent,
     * or against the player's own averages when there is no opponent.
     */
    @Override
    public List<Map<String, Object>> getSkillFocus(PlayerMatchFrame frame,
                                                   Map<String, Object> lastMatchStats,
                                                   Map<String, Object> enemyStats) {
        boolean versusOpponent = enemyStats != null && !enemyStats.isEmpty();
        List<Map<String, Object>> gaps = new ArrayList<>();
        for (String feature : TIPS.keySet()) {
            Double yours = number(lastMatchStats.get(feature));
            Double reference = versusOpponent ? number(enemyStats.get(feature)) : finiteOrNull(frame.mean(feature));
            if (yours == null || reference == null) {
                continue;
            }
            double gap = (yours - reference) / Math.max(Math.abs(reference), 1.0);
            if (gap >= 0) {
                continue;
            }
            Map<String, Object> focus = new LinkedHashMap<>();
            focus.put("focus", feature);
            focus.put("yourValue", yours);
            focus.put(versusOpponent ? "opponentValue" : "averageValue", reference);
            focus.put("gap", gap);
            focus.put("tip", TIPS.get(feature));
            gaps.add(focus);
        }
        gaps.sort(Comparator.comparingDouble(m -> (Double) m.get("gap")));
        return new ArrayList<>(gaps.subList(0, Math.min(3, gaps.size())));
    }

    private static Double number(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return finiteOrNull(((Number) value).doubleValue());
        }
        return null;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
