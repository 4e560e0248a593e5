package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored per-step metrics of a funnel for one period (yyyy-MM-dd of the period start).
 */
@Entity
@Table(name = "funnel_metrics",
    uniqueConstraints = @UniqueConstraint(name = "uq_funnel_step_period", columnNames = {"funnelId", "stepNumber", "period"}),
    indexes = @Index(name = "idx_metrics_funnel_period", columnList = "funnelId,period"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelMetricsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;
    
    @Column(nullable = false, columnDefinition = "UUID")
    private UUID funnelId;
    
    @Column(nullable = false, length = 255)
    private String step;
    
    @Column(nullable = false)
    private int stepNumber;
    
    @Column(nullable = false)
    private long totalCount;
    
    @Column(nullable = false)
    private double conversionRate;
    
    @Column(nullable = false)
    private double dropOffRate;
    
    @Column(nullable = false)
    private double avgTimeToNext;
    
    @Column(nullable = false)
    private double avgTimeFromStart;
    
    @Column(nullable = false, length = 10)
    private String period;
    
    @Column(nullable = false)
    private Instant periodStart;
    
    @Column(nullable = false)
    private Instant periodEnd;
    
    @Column(nullable = false)
    private Instant calculatedAt;
    
    @PrePersist
    @PreUpdate
    protected void onSave() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        calculatedAt = Instant.now();
    }
}
