package com.riftinsight.infrastructure.persistence.repository;

import com.riftinsight.infrastructure.persistence.entity.SummonerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SummonerRepository extends JpaRepository<SummonerEntity, String> {
}
