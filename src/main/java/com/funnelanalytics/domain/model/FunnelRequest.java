package com.funnelanalytics.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for creating a funnel.
 *
 * Step order and predicate rules are checked by the definition validator, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelRequest {

    @NotBlank
    @Size(max = 255)
    private String name;
    
    private String description;
    
    @NotNull
    @Size(min = 2, message = "Funnel must have at least 2 steps")
    private List<FunnelStep> steps;
    
    // Optional time-box between consecutive steps
    @Positive
    private Long maxStepIntervalSeconds;
    
    private Boolean trackingEnabled;
}
