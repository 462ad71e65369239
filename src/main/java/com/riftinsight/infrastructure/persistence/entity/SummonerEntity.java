package com.riftinsight.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A resolved player. Keyed by PUUID, which never changes even when the Riot ID does.
 */
@Entity
@Table(name = "summoners", indexes = {
    @Index(name = "idx_riot_id", columnList = "gameName,tagLine")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummonerEntity {

    @Id
    @Column(length = 100)
    private String puuid;

    @Column(nullable = false, length = 64)
    private String gameName;

    @Column(nullable = false, length = 16)
    private String tagLine;

    @Column(nullable = false, length = 8)
    private String region;

    @Column
    private int profileIconId;

    @Column
    private long summonerLevel;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        updatedAt = Instant.now();
    }
}
