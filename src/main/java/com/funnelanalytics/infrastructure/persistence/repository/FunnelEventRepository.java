package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for funnel event snapshots.
 */
@Repository
public interface FunnelEventRepository extends JpaRepository<FunnelEventEntity, Long> {

    /**
     * All events of a funnel inside [startTime, endTime], in ingestion order.
     *
     * Served by idx_funnel_timestamp.
     */
    @Query("SELECT e FROM FunnelEventEntity e WHERE " +
           "e.funnelId = :funnelId AND " +
           "e.timestamp BETWEEN :startTime AND :endTime " +
           "ORDER BY e.timestamp ASC, e.id ASC")
    List<FunnelEventEntity> findEventsInPeriod(
            @Param("funnelId") UUID funnelId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );
    
    void deleteByFunnelId(UUID funnelId);
}
