package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.CohortBucket;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.SessionJourney;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups journeys by the period they entered the funnel.
 *
 * Every journey lands in exactly one bucket, so bucket totals add up to the session count.
 * Buckets come back in ascending date order.
 */
@Component
@RequiredArgsConstructor
public class CohortBucketizer {

    private final StepAggregator stepAggregator;
    
    public List<CohortBucket> bucketize(FunnelDefinition definition,
                                        List<SessionJourney> journeys,
                                        CohortGranularity granularity) {
        Map<String, StepTally> cohorts = new TreeMap<>();
        for (SessionJourney journey : journeys) {
            cohorts.computeIfAbsent(granularity.label(journey.getEntryTime()),
                    label -> new StepTally(definition.stepCount()))
                    .add(journey);
        }
        
        List<CohortBucket> buckets = new ArrayList<>(cohorts.size());
        cohorts.forEach((cohortDate, tally) -> buckets.add(CohortBucket.builder()
                .cohortDate(cohortDate)
                .totalUsers(tally.sessions())
                .completedUsers(tally.completed())
                .completionRate(stepAggregator.completionRate(tally))
                .avgCompletionTime(stepAggregator.averageTimeToComplete(tally))
                .build()));
        return buckets;
    }
}
