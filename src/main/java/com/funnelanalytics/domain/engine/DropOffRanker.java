package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.DropOffPoint;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the steps where sessions were lost.
 *
 * Ordered by drop-off count descending, ties by step order ascending. Steps that lost nobody
 * are left out.
 */
@Component
public class DropOffRanker {

    private static final Comparator<DropOffPoint> RANKING = Comparator
            .comparingLong(DropOffPoint::getDropOffCount).reversed()
            .thenComparingInt(DropOffPoint::getStepNumber);
    
    public List<DropOffPoint> rank(FunnelDefinition definition, StepTally tally, int limit) {
        List<DropOffPoint> points = new ArrayList<>();
        for (int i = 1; i < definition.stepCount(); i++) {
            long dropOffCount = tally.dropOffCount(i);
            if (dropOffCount == 0) {
                continue;
            }
            FunnelStep step = definition.step(i);
            points.add(DropOffPoint.builder()
                    .step(step.getName())
                    .stepNumber(step.getOrder())
                    .dropOffCount(dropOffCount)
                    .dropOffRate(Rates.percentage(dropOffCount, tally.reached(i - 1)))
                    .build());
        }
        points.sort(RANKING);
        return points.size() > limit ? List.copyOf(points.subList(0, limit)) : points;
    }
    
    /** Name of the step with the largest drop-off, if any session was lost. */
    public Optional<String> topDropOffStep(FunnelDefinition definition, StepTally tally) {
        return rank(definition, tally, 1).stream()
                .findFirst()
                .map(DropOffPoint::getStep);
    }
}
