package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A tracked visitor event.
 *
 * The generated id doubles as the ingestion sequence used to order events with equal timestamps.
 *
 * Indexing Strategy:
 * - Composite index on (funnelId, timestamp) for period scans
 * - Index on sessionId for per-visitor lookups
 */
@Entity
@Table(name = "funnel_events", indexes = {
    @Index(name = "idx_funnel_timestamp", columnList = "funnelId,timestamp"),
    @Index(name = "idx_session", columnList = "sessionId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, columnDefinition = "UUID")
    private UUID funnelId;
    
    @Column(nullable = false, length = 255)
    private String sessionId;
    
    @Column(nullable = false, length = 100)
    private String eventType;
    
    @Column(columnDefinition = "TEXT")
    private String properties;
    
    @Column(nullable = false)
    private Instant timestamp;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (timestamp == null) {
            timestamp = createdAt;
        }
    }
}
