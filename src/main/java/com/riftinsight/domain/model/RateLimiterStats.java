package com.riftinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time snapshot of the upstream rate limiter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimiterStats {

    private int maxConcurrent;
    private int inFlight;
    private int queued;
}
