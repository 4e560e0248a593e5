package com.funnelanalytics.domain.model;

import lombok.Value;

import java.time.Instant;

/** Earliest instant a session satisfied {@code stepIndex} after satisfying the step before it. */
@Value
public class StepReach {

    String sessionId;
    int stepIndex;
    Instant timestamp;
}
