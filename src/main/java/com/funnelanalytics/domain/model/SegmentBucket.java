package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Completion metrics for sessions sharing one value of a segment dimension. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentBucket {

    private String segment;
    private long totalUsers;
    private long completedUsers;
    private double completionRate;
    private double avgCompletionTime;
    private String topDropOffStep;
}
