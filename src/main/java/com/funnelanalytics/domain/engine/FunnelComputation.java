package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.SessionJourney;
import lombok.Value;

import java.util.List;

/**
 * Matched journeys for every in-window session, plus their merged tally.
 *
 * Journeys are in sessionId order. {@code definition} has its steps sorted by order.
 */
@Value
public class FunnelComputation {

    FunnelDefinition definition;
    List<SessionJourney> journeys;
    StepTally tally;
    
    public long totalSessions() {
        return journeys.size();
    }
}
