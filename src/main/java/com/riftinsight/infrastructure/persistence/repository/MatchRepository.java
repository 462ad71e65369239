package com.riftinsight.infrastructure.persistence.repository;

import com.riftinsight.infrastructure.persistence.entity.MatchEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for stored match documents.
 */
@Repository
public interface MatchRepository extends JpaRepository<MatchEntity, String> {

    /**
     * Most recent matches a player took part in, newest first.
     */
    @Query("SELECT m FROM MatchEntity m WHERE m.matchId IN " +
           "(SELECT p.matchId FROM ParticipantEntity p WHERE p.puuid = :puuid) " +
           "ORDER BY m.gameCreation DESC")
    List<MatchEntity> findRecentByPuuid(
            @Param("puuid") String puuid,
            Pageable pageable
    );
}
