package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * A named, ordered sequence of funnel steps.
 *
 * {@code maxStepInterval} is the optional time-box: when set, a step only counts if it is reached
 * within that interval of the previous step. Null means no limit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunnelDefinition {

    private UUID id;
    private String name;
    private String description;
    private List<FunnelStep> steps;
    private Duration maxStepInterval;
    
    @Builder.Default
    private boolean trackingEnabled = true;
    
    public int stepCount() {
        return steps.size();
    }
    
    public FunnelStep step(int index) {
        return steps.get(index);
    }
}
