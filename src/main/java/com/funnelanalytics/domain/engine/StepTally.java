package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.SessionJourney;

/**
 * Additive per-step counters for a set of session journeys.
 *
 * Tallies built over disjoint journey sets can be merged in any order with the same outcome.
 * Times are integral milliseconds so merged sums are exact.
 *
 * Not thread-safe: each worker fills its own tally and the caller merges them.
 */
public final class StepTally {

    private final int stepCount;
    private long sessions;
    private final long[] reached;
    // sum of reach[i+1] - reach[i]; sample count is reached[i + 1]
    private final long[] toNextMillis;
    // sum of reach[i] - reach[0]; sample count is reached[i]
    private final long[] fromStartMillis;
    
    public StepTally(int stepCount) {
        this.stepCount = stepCount;
        this.reached = new long[stepCount];
        this.toNextMillis = new long[stepCount];
        this.fromStartMillis = new long[stepCount];
    }
    
    public static StepTally of(int stepCount, Iterable<SessionJourney> journeys) {
        StepTally tally = new StepTally(stepCount);
        for (SessionJourney journey : journeys) {
            tally.add(journey);
        }
        return tally;
    }
    
    public StepTally add(SessionJourney journey) {
        sessions++;
        int reachedSteps = journey.reachedSteps();
        for (int i = 0; i < reachedSteps; i++) {
            reached[i]++;
            if (i > 0) {
                toNextMillis[i - 1] += journey.millisBetween(i - 1, i);
                fromStartMillis[i] += journey.millisBetween(0, i);
            }
        }
        return this;
    }
    
    public StepTally merge(StepTally other) {
        if (other.stepCount != stepCount) {
            throw new IllegalArgumentException("Cannot merge tallies of " + stepCount + " and " + other.stepCount + " steps");
        }
        sessions += other.sessions;
        for (int i = 0; i < stepCount; i++) {
            reached[i] += other.reached[i];
            toNextMillis[i] += other.toNextMillis[i];
            fromStartMillis[i] += other.fromStartMillis[i];
        }
        return this;
    }
    
    public long sessions() {
        return sessions;
    }
    
    public long reached(int step) {
        return reached[step];
    }
    
    public long toNextMillis(int step) {
        return toNextMillis[step];
    }
    
    /** Sessions that reached both {@code step} and the step after it. */
    public long toNextSamples(int step) {
        return step + 1 < stepCount ? reached[step + 1] : 0;
    }
    
    public long fromStartMillis(int step) {
        return fromStartMillis[step];
    }
    
    /** Sessions lost between step - 1 and step; 0 for the first step. */
    public long dropOffCount(int step) {
        if (step <= 0) {
            return 0;
        }
        return Math.max(0, reached[step - 1] - reached[step]);
    }
    
    public long completed() {
        return reached[stepCount - 1];
    }
    
    public long completionMillis() {
        return fromStartMillis[stepCount - 1];
    }
}
