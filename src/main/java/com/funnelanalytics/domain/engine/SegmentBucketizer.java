package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.SegmentBucket;
import com.funnelanalytics.domain.model.SegmentDimension;
import com.funnelanalytics.domain.model.SessionJourney;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups journeys by a session attribute taken from the first event.
 *
 * Only segments with at least one session are returned, largest first.
 */
@Component
@RequiredArgsConstructor
public class SegmentBucketizer {

    public static final String NO_DROP_OFF = "None";
    
    private static final Comparator<SegmentBucket> LARGEST_FIRST = Comparator
            .comparingLong(SegmentBucket::getTotalUsers).reversed()
            .thenComparing(SegmentBucket::getSegment);
    
    private final StepAggregator stepAggregator;
    private final DropOffRanker dropOffRanker;
    
    public List<SegmentBucket> bucketize(FunnelDefinition definition,
                                         List<SessionJourney> journeys,
                                         SegmentDimension dimension) {
        Map<String, StepTally> segments = new TreeMap<>();
        for (SessionJourney journey : journeys) {
            segments.computeIfAbsent(dimension.segmentOf(journey.getEntryAttributes()),
                    segment -> new StepTally(definition.stepCount()))
                    .add(journey);
        }
        
        List<SegmentBucket> buckets = new ArrayList<>(segments.size());
        segments.forEach((segment, tally) -> buckets.add(SegmentBucket.builder()
                .segment(segment)
                .totalUsers(tally.sessions())
                .completedUsers(tally.completed())
                .completionRate(stepAggregator.completionRate(tally))
                .avgCompletionTime(stepAggregator.averageTimeToComplete(tally))
                .topDropOffStep(dropOffRanker.topDropOffStep(definition, tally).orElse(NO_DROP_OFF))
                .build()));
        buckets.sort(LARGEST_FIRST);
        return buckets;
    }
}
