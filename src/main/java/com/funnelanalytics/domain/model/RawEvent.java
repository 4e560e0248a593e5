package com.funnelanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single visitor event as handed to the analysis engine.
 *
 * {@code sequence} is the ingestion order and breaks ties between events with equal timestamps.
 */
@Value
@Builder
public class RawEvent {

    String sessionId;
    String eventType;
    Instant timestamp;
    @Singular
    Map<String, String> attributes;
    long sequence;
    
    public String attribute(String name) {
        return attributes.get(name);
    }
}
