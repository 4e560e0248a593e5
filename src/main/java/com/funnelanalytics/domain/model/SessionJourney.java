package com.funnelanalytics.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * How far one session progressed through a funnel.
 *
 * {@code reaches} holds one entry per reached step, in step order, so {@code reaches.get(i)} is the
 * reach of step i. {@code entryTime} is the step 0 reach, or the first event when step 0 never matched.
 */
@Value
public class SessionJourney {

    String sessionId;
    Instant entryTime;
    Map<String, String> entryAttributes;
    List<StepReach> reaches;
    
    public int reachedSteps() {
        return reaches.size();
    }
    
    public boolean completed(int stepCount) {
        return reaches.size() == stepCount;
    }
    
    public long millisBetween(int fromStep, int toStep) {
        return Duration.between(reaches.get(fromStep).getTimestamp(), reaches.get(toStep).getTimestamp()).toMillis();
    }
}
