package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-step funnel statistics.
 *
 * Rates are percentages; times are seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepAggregate {

    private String step;
    private int stepNumber;
    private long totalUsers;
    private double conversionRate;
    private double dropOffRate;
    private double avgTimeToNext;
    private double avgTimeFromStart;
}
