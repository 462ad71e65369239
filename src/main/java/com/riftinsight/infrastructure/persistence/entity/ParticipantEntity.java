package com.riftinsight.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One player's line in a match.
 *
 * gameCreation/gameDuration are copied from the match so the per-player history
 * query needs no join.
 *
 * Indexing Strategy:
 * - Composite index on (puuid, gameCreation) for "latest N matches of a player"
 * - Index on matchId for loading all participants of a match
 */
@Entity
@Table(name = "participants", indexes = {
    @Index(name = "idx_puuid_creation", columnList = "puuid,gameCreation"),
    @Index(name = "idx_match_id", columnList = "matchId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String matchId;

    @Column(nullable = false, length = 100)
    private String puuid;

    @Column
    private int participantId;

    @Column
    private int teamId;

    @Column(length = 16)
    private String teamPosition;

    @Column(length = 32)
    private String championName;

    @Column
    private boolean win;

    @Column(nullable = false)
    private long gameCreation;

    @Column(nullable = false)
    private long gameDuration;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String statsJson;
}
