package com.funnelanalytics.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Request model for tracking a visitor event against a funnel.
 *
 * timestamp defaults to the time the event is stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackEventRequest {

    @NotNull
    private UUID funnelId;
    
    @NotBlank
    @Size(max = 255)
    private String sessionId;
    
    @NotBlank
    @Size(max = 100)
    private String eventType;
    
    private Instant timestamp;
    
    private Map<String, String> properties;
}
