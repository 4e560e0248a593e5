package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.DropOffPoint;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.StepAggregate;
import org.springframework.stereotype.Component;

import java.util.List;

/** Packages already computed statistics into the public result shape. */
@Component
public class FunnelResultAssembler {

    public FunnelAnalysisResult assemble(FunnelDefinition definition,
                                         long totalSessions,
                                         double completionRate,
                                         double averageTimeToComplete,
                                         List<StepAggregate> steps,
                                         List<DropOffPoint> dropOffPoints) {
        return FunnelAnalysisResult.builder()
                .funnelId(definition.getId())
                .funnelName(definition.getName())
                .totalSessions(totalSessions)
                .completionRate(completionRate)
                .averageTimeToComplete(averageTimeToComplete)
                .steps(List.copyOf(steps))
                .dropOffPoints(List.copyOf(dropOffPoints))
                .build();
    }
}
