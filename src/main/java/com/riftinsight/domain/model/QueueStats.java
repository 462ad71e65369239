package com.riftinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time snapshot of the analysis admission queue.
 *
 * Served as-is by GET /api/queue and embedded in every progress event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    private int maxConcurrent;
    private int active;
    private int queued;
}
