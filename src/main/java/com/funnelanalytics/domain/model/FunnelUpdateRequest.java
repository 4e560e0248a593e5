package com.funnelanalytics.domain.model;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Partial update of a funnel; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelUpdateRequest {

    @Size(min = 1, max = 255)
    private String name;
    
    private String description;
    
    @Size(min = 2, message = "Funnel must have at least 2 steps")
    private List<FunnelStep> steps;
    
    @Positive
    private Long maxStepIntervalSeconds;
    
    private Boolean trackingEnabled;
}
