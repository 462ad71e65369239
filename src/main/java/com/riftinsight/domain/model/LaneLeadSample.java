package com.riftinsight.domain.model;

import lombok.Value;

/**
 * Gold and xp lead over the lane opponent at the target minute of one match.
 */
@Value
public class LaneLeadSample {

    double goldLead;
    double xpLead;
}
