package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FunnelMetricsRepository extends JpaRepository<FunnelMetricsEntity, UUID> {

    Optional<FunnelMetricsEntity> findByFunnelIdAndStepNumberAndPeriod(UUID funnelId, int stepNumber, String period);
    
    List<FunnelMetricsEntity> findByFunnelIdOrderByPeriodDescStepNumberAsc(UUID funnelId);
    
    List<FunnelMetricsEntity> findByFunnelIdAndPeriodOrderByStepNumberAsc(UUID funnelId, String period);
    
    void deleteByFunnelId(UUID funnelId);
}
