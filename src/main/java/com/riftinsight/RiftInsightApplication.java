package com.riftinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Rift Insight analysis backend
 *
 * Streams a per-player analysis of recent ranked games built from the Riot API.
 *
 * Architecture:
 * - NDJSON streaming REST endpoint with a process-wide admission queue
 * - Upstream gateway with bounded concurrency, retries and a response cache
 * - Match store (JPA) fed by incremental ingestion
 * - Baseline scoring model and timeline analyses over stored matches
 */
@SpringBootApplication
public class RiftInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiftInsightApplication.class, args);
    }
}
