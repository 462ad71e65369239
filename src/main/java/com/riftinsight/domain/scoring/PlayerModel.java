package com.riftinsight.domain.scoring;

import java.util.List;
import java.util.Map;

/**
 * Scoring collaborator operating over a player's match table.
 *
 * Implementations must be stateless between calls: a trained model is returned
 * as a value and handed back, so concurrent analyses never share state.
 */
public interface PlayerModel {

    TrainingResult train(PlayerMatchFrame frame);

    /**
     * Win probability in percent for one match's stats.
     */
    double predictWinProbability(TrainingResult trained, Map<String, Object> matchStats);

    Map<String, Object> calculateWeightedAverages(PlayerMatchFrame frame);

    List<Map<String, Object>> analyzePlayerMood(PlayerMatchFrame frame);

    List<Map<String, Object>> getWinDriverInsights(TrainingResult trained, PlayerMatchFrame frame,
                                                   Map<String, Object> lastMatchStats,
                                                   Map<String, Object> enemyStats);

    List<Map<String, Object>> getSkillFocus(PlayerMatchFrame frame,
                                            Map<String, Object> lastMatchStats,
                                            Map<String, Object> enemyStats);
}
