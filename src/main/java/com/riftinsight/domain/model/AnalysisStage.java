package com.riftinsight.domain.model;

/**
 * Phases of one analysis stream, in emission order, with their base progress percent.
 */
public enum AnalysisStage {
    QUEUED(0, "Waiting for a free analysis slot..."),
    FIND_ACCOUNT(5, "Finding user account..."),
    FETCH_RANKED(8, "Fetching ranked info..."),
    MATCH_HISTORY(10, "Fetching match history..."),
    LOAD_MATCH_DATA(72, "Loading match data..."),
    TRAIN_MODEL(75, "Training AI model..."),
    PERFORMANCE_METRICS(78, "Calculating performance metrics..."),
    LANE_LEADS(79, "Computing lane leads..."),
    MOOD(80, "Analyzing player mood..."),
    TERRITORIAL(83, "Analyzing territorial control..."),
    WIN_PROB(88, "Calculating win probability..."),
    OPPONENT_COMPARE(90, "Comparing with opponent..."),
    WIN_FACTORS(92, "Analyzing win factors..."),
    FETCH_TIMELINE(95, "Fetching match timeline..."),
    PREPARE_RESULTS(98, "Preparing results...");

    private final int percent;
    private final String message;

    AnalysisStage(int percent, String message) {
        this.percent = percent;
        this.message = message;
    }

    public int getPercent() {
        return percent;
    }

    public String getMessage() {
        return message;
    }
}
