package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.SessionJourney;
import com.funnelanalytics.domain.model.StepReach;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks one session against the funnel's steps in a single pass.
 *
 * An event can only satisfy the next unmatched step, so step i is never reached before step i-1
 * and each step is reached at most once. With a time-box configured, the scan stops at the first
 * event that would reach a step later than the time-box allows.
 *
 * Pure function of the session and the definition; safe to run concurrently.
 */
@Component
public class StepMatcher {

    public SessionJourney match(Session session, FunnelDefinition definition) {
        int stepCount = definition.stepCount();
        Duration maxStepInterval = definition.getMaxStepInterval();
        List<StepReach> reaches = new ArrayList<>(stepCount);
        
        int nextStep = 0;
        Instant previousReach = null;
        for (RawEvent event : session.getEvents()) {
            if (nextStep == stepCount) {
                break;
            }
            if (!definition.step(nextStep).getPredicate().matches(event)) {
                continue;
            }
            if (previousReach != null && maxStepInterval != null
                    && Duration.between(previousReach, event.getTimestamp()).compareTo(maxStepInterval) > 0) {
                break;
            }
            reaches.add(new StepReach(session.getSessionId(), nextStep, event.getTimestamp()));
            previousReach = event.getTimestamp();
            nextStep++;
        }
        
        RawEvent firstEvent = session.firstEvent();
        Instant entryTime = reaches.isEmpty() ? firstEvent.getTimestamp() : reaches.get(0).getTimestamp();
        return new SessionJourney(session.getSessionId(), entryTime, firstEvent.getAttributes(), List.copyOf(reaches));
    }
}
