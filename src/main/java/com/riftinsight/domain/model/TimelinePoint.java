package com.riftinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-minute snapshot of gold/xp/cs differences between the subject and the
 * enemy team (goldDelta, xpDelta) and the lane opponent (lane*).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelinePoint {

    private double minute;
    private double goldDelta;
    private double xpDelta;
    private double laneGoldDelta;
    private double laneXpDelta;
    private double laneCsDelta;
}
