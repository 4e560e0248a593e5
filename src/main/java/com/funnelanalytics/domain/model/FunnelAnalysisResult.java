package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Overall funnel analysis for one period.
 *
 * completionRate is a percentage of totalSessions; averageTimeToComplete is in seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelAnalysisResult {

    private UUID funnelId;
    private String funnelName;
    private long totalSessions;
    private double completionRate;
    private double averageTimeToComplete;
    private List<StepAggregate> steps;
    private List<DropOffPoint> dropOffPoints;
}
