package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.FunnelDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FunnelDefinitionRepository extends JpaRepository<FunnelDefinitionEntity, UUID> {

    List<FunnelDefinitionEntity> findAllByOrderByCreatedAtDesc();
}
