package com.riftinsight.domain.model;

import lombok.Value;

/**
 * Progress tuple reported once per match while ingesting match history.
 */
@Value
public class IngestionProgress {

    int current;
    int total;
    String status;
}
