package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.StepAggregate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link StepTally} into per-step and funnel-level statistics.
 *
 * Overall, cohort and segment results all go through here so they stay consistent.
 */
@Component
public class StepAggregator {

    public List<StepAggregate> aggregate(FunnelDefinition definition, StepTally tally) {
        int stepCount = definition.stepCount();
        long entered = tally.reached(0);
        List<StepAggregate> aggregates = new ArrayList<>(stepCount);
        
        for (int i = 0; i < stepCount; i++) {
            FunnelStep step = definition.step(i);
            long totalUsers = tally.reached(i);
            double dropOffRate = i == 0 ? 0 : Rates.percentage(tally.dropOffCount(i), tally.reached(i - 1));
            
            aggregates.add(StepAggregate.builder()
                    .step(step.getName())
                    .stepNumber(step.getOrder())
                    .totalUsers(totalUsers)
                    .conversionRate(Rates.percentage(totalUsers, entered))
                    .dropOffRate(dropOffRate)
                    .avgTimeToNext(Rates.meanSeconds(tally.toNextMillis(i), tally.toNextSamples(i)))
                    .avgTimeFromStart(Rates.meanSeconds(tally.fromStartMillis(i), totalUsers))
                    .build());
        }
        return aggregates;
    }
    
    /** Sessions that reached the last step, as a percentage of all sessions in the tally. */
    public double completionRate(StepTally tally) {
        return Rates.percentage(tally.completed(), tally.sessions());
    }
    
    /** Mean seconds from step 0 to the last step over completed sessions. */
    public double averageTimeToComplete(StepTally tally) {
        return Rates.meanSeconds(tally.completionMillis(), tally.completed());
    }
}
