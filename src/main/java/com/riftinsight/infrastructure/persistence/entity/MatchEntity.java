package com.riftinsight.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A completed match, stored as the raw match-v5 document.
 *
 * The document is immutable once the game has ended, so rows are written once
 * and never updated. A fresh entity is always inserted, never merged, so a second
 * insert of the same match fails on the primary key.
 */
@Entity
@Table(name = "matches", indexes = {
    @Index(name = "idx_game_creation", columnList = "gameCreation")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchEntity implements Persistable<String> {

    @Id
    @Column(length = 32)
    private String matchId;

    @Column(nullable = false)
    private long gameCreation;

    @Column(nullable = false)
    private long gameDuration;

    @Column
    private int queueId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String data;

    @Column(nullable = false)
    private Instant createdAt;

    @Transient
    private boolean persisted;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        persisted = true;
    }

    @Override
    public String getId() {
        return matchId;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }
}
