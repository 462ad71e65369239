package com.riftinsight.infrastructure.persistence.repository;

import com.riftinsight.infrastructure.persistence.entity.ParticipantEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParticipantRepository extends JpaRepository<ParticipantEntity, Long> {

    List<ParticipantEntity> findByPuuidOrderByGameCreationDesc(String puuid, Pageable pageable);
}
