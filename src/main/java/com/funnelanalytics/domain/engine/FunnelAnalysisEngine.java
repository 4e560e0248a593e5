package com.funnelanalytics.domain.engine;

import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.exception.AnalysisCancelledException;
import com.funnelanalytics.domain.model.CohortBucket;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.DropOffPoint;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.domain.model.SegmentBucket;
import com.funnelanalytics.domain.model.SegmentDimension;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.SessionJourney;
import com.funnelanalytics.domain.model.StepAggregate;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a funnel over an immutable event snapshot.
 *
 * Flow:
 * 1. Validate the definition (nothing is processed for an invalid one)
 * 2. Build sessions from in-window events
 * 3. Match sessions in parallel shards, each returning its journeys and a partial tally
 * 4. Merge partial tallies on the calling thread
 * 5. Aggregate, rank drop-offs, or bucket by cohort / segment
 *
 * Every call is bound to a deadline. Past it, or on interruption, outstanding shards are
 * cancelled and {@link AnalysisCancelledException} is thrown instead of a partial result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FunnelAnalysisEngine {

    private final FunnelDefinitionValidator validator;
    private final SessionBuilder sessionBuilder;
    private final StepMatcher stepMatcher;
    private final StepAggregator stepAggregator;
    private final DropOffRanker dropOffRanker;
    private final CohortBucketizer cohortBucketizer;
    private final SegmentBucketizer segmentBucketizer;
    private final FunnelResultAssembler resultAssembler;
    private final ExecutorService funnelAnalysisExecutor;
    private final FunnelProperties properties;
    
    public FunnelAnalysisResult analyze(FunnelDefinition definition,
                                        Collection<RawEvent> events,
                                        Instant periodStart,
                                        Instant periodEnd,
                                        Instant deadline) {
        FunnelComputation computation = compute(definition, events, periodStart, periodEnd, deadline);
        FunnelDefinition funnel = computation.getDefinition();
        StepTally tally = computation.getTally();
        
        List<StepAggregate> steps = stepAggregator.aggregate(funnel, tally);
        List<DropOffPoint> dropOffPoints = dropOffRanker.rank(funnel, tally,
                properties.getAnalysis().getDropOffLimit());
        
        return resultAssembler.assemble(funnel,
                computation.totalSessions(),
                stepAggregator.completionRate(tally),
                stepAggregator.averageTimeToComplete(tally),
                steps,
                dropOffPoints);
    }
    
    public List<CohortBucket> cohorts(FunnelDefinition definition,
                                      Collection<RawEvent> events,
                                      Instant periodStart,
                                      Instant periodEnd,
                                      CohortGranularity granularity,
                                      Instant deadline) {
        FunnelComputation computation = compute(definition, events, periodStart, periodEnd, deadline);
        return cohortBucketizer.bucketize(computation.getDefinition(), computation.getJourneys(), granularity);
    }
    
    public List<SegmentBucket> segments(FunnelDefinition definition,
                                        Collection<RawEvent> events,
                                        Instant periodStart,
                                        Instant periodEnd,
                                        SegmentDimension dimension,
                                        Instant deadline) {
        FunnelComputation computation = compute(definition, events, periodStart, periodEnd, deadline);
        return segmentBucketizer.bucketize(computation.getDefinition(), computation.getJourneys(), dimension);
    }
    
    public FunnelComputation compute(FunnelDefinition definition,
                                     Collection<RawEvent> events,
                                     Instant periodStart,
                                     Instant periodEnd,
                                     Instant deadline) {
        FunnelDefinition funnel = validator.normalize(definition);
        
        List<Session> sessions = sessionBuilder.build(events, periodStart, periodEnd);
        List<List<Session>> shards = partition(sessions, Math.max(1, properties.getAnalysis().getShardSize()));
        log.debug("Matching {} sessions in {} shards for funnel {}", sessions.size(), shards.size(), funnel.getId());
        
        List<Future<ShardResult>> futures = new ArrayList<>(shards.size());
        try {
            for (List<Session> shard : shards) {
                futures.add(funnelAnalysisExecutor.submit(() -> matchShard(shard, funnel)));
            }
            
            List<SessionJourney> journeys = new ArrayList<>(sessions.size());
            StepTally tally = new StepTally(funnel.stepCount());
            for (Future<ShardResult> future : futures) {
                long remainingNanos = Duration.between(Instant.now(), deadline).toNanos();
                if (remainingNanos <= 0) {
                    throw new TimeoutException();
                }
                ShardResult result = future.get(remainingNanos, TimeUnit.NANOSECONDS);
                journeys.addAll(result.getJourneys());
                tally.merge(result.getTally());
            }
            return new FunnelComputation(funnel, List.copyOf(journeys), tally);
        
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new AnalysisCancelledException("Analysis of funnel " + funnel.getId() + " exceeded its deadline", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new AnalysisCancelledException("Analysis of funnel " + funnel.getId() + " was interrupted", e);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new AnalysisCancelledException("Analysis of funnel " + funnel.getId() + " was cancelled", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            log.error("Step matching failed for funnel {}: {}", funnel.getId(), e.getCause().getMessage(), e.getCause());
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Step matching failed", e.getCause());
        }
    }
    
    private ShardResult matchShard(List<Session> shard, FunnelDefinition funnel) {
        List<SessionJourney> journeys = new ArrayList<>(shard.size());
        StepTally tally = new StepTally(funnel.stepCount());
        for (Session session : shard) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Shard abandoned");
            }
            SessionJourney journey = stepMatcher.match(session, funnel);
            journeys.add(journey);
            tally.add(journey);
        }
        return new ShardResult(journeys, tally);
    }
    
    private static void cancelAll(List<Future<ShardResult>> futures) {
        futures.forEach(future -> future.cancel(true));
    }
    
    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> parts = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            parts.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return parts;
    }
    
    @Value
    private static class ShardResult {
        List<SessionJourney> journeys;
        StepTally tally;
    }
}
