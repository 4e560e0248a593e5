package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Completion metrics for sessions that entered the funnel in the same period. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortBucket {

    private String cohortDate;
    private long totalUsers;
    private long completedUsers;
    private double completionRate;
    private double avgCompletionTime;
}
