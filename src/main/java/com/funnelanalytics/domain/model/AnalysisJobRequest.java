package com.funnelanalytics.domain.model;

import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Parameters of an async analysis job.
 *
 * granularity applies to COHORT jobs, dimension to SEGMENT jobs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisJobRequest {

    @NotNull
    private AsyncJobEntity.JobType jobType;
    
    @NotNull
    private UUID funnelId;
    
    private Instant periodStart;
    private Instant periodEnd;
    private String granularity;
    private String dimension;
}
