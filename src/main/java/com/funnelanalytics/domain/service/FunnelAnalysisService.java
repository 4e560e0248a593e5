package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.engine.FunnelAnalysisEngine;
import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import com.funnelanalytics.domain.model.CohortBucket;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.domain.model.SegmentBucket;
import com.funnelanalytics.domain.model.SegmentDimension;
import com.funnelanalytics.infrastructure.cache.AnalysisCacheService;
import com.funnelanalytics.infrastructure.persistence.mapper.FunnelEntityMapper;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Funnel analysis queries.
 *
 * Query Flow:
 * 1. Parse dimension / granularity and resolve the period (bad input fails here)
 * 2. Check cache (Redis)
 * 3. On a miss, load the funnel definition and the period's events
 * 4. Run the analysis engine under a deadline
 * 5. Store result in cache
 *
 * A period without events is not an error: it yields a zero-valued result.
 *
 * Cache keys use the bounds as requested. An omitted bound is keyed as "default", so the rolling
 * default window is reused until the entry's TTL expires.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelAnalysisService {

    static final String DEFAULT_BOUND = "default";
    
    private final FunnelDefinitionService definitionService;
    private final FunnelEventRepository eventRepository;
    private final FunnelEntityMapper mapper;
    private final FunnelAnalysisEngine engine;
    private final AnalysisCacheService cacheService;
    private final FunnelProperties properties;
    private final MeterRegistry meterRegistry;
    
    @Transactional(readOnly = true)
    public FunnelAnalysisResult analyzeFunnel(UUID funnelId, Instant periodStart, Instant periodEnd) {
        return analyzeFunnel(funnelId, periodStart, periodEnd, properties.getAnalysis().getTimeout());
    }
    
    @Transactional(readOnly = true)
    public List<CohortBucket> cohortAnalysis(UUID funnelId, Instant periodStart, Instant periodEnd, String granularity) {
        return cohortAnalysis(funnelId, periodStart, periodEnd, granularity, properties.getAnalysis().getTimeout());
    }
    
    @Transactional(readOnly = true)
    public List<SegmentBucket> segmentAnalysis(UUID funnelId, String dimension, Instant periodStart, Instant periodEnd) {
        return segmentAnalysis(funnelId, dimension, periodStart, periodEnd, properties.getAnalysis().getTimeout());
    }
    
    @Transactional(readOnly = true)
    FunnelAnalysisResult analyzeFunnel(UUID funnelId, Instant periodStart, Instant periodEnd, Duration timeout) {
        AnalysisPeriod period = AnalysisPeriod.resolve(periodStart, periodEnd, properties.getAnalysis().getDefaultLookback());
        String cacheKey = cacheService.generateCacheKey("analysis", funnelId,
                bound(periodStart), bound(periodEnd));
        
        return execute("analysis", funnelId,
                () -> cacheService.get(cacheKey, FunnelAnalysisResult.class),
                () -> computeAnalysis(funnelId, period, timeout),
                result -> cacheService.set(cacheKey, result, properties.getCache().getAnalysisTtlSeconds()));
    }
    
    @Transactional(readOnly = true)
    List<CohortBucket> cohortAnalysis(UUID funnelId, Instant periodStart, Instant periodEnd,
                                      String granularity, Duration timeout) {
        CohortGranularity cohortGranularity = CohortGranularity.fromName(granularity);
        AnalysisPeriod period = AnalysisPeriod.resolve(periodStart, periodEnd, properties.getAnalysis().getDefaultLookback());
        String cacheKey = cacheService.generateCacheKey("cohort", funnelId,
                bound(periodStart), bound(periodEnd), cohortGranularity);
        
        return execute("cohort", funnelId,
                () -> cacheService.getList(cacheKey, CohortBucket.class),
                () -> {
                    FunnelDefinition definition = definitionService.getFunnel(funnelId);
                    return engine.cohorts(definition, loadEvents(funnelId, period), period.getStart(), period.getEnd(),
                            cohortGranularity, deadline(timeout));
                },
                result -> cacheService.set(cacheKey, result, properties.getCache().getCohortTtlSeconds()));
    }
    
    @Transactional(readOnly = true)
    List<SegmentBucket> segmentAnalysis(UUID funnelId, String dimension, Instant periodStart, Instant periodEnd,
                                        Duration timeout) {
        SegmentDimension segmentDimension = SegmentDimension.fromName(dimension);
        AnalysisPeriod period = AnalysisPeriod.resolve(periodStart, periodEnd, properties.getAnalysis().getDefaultLookback());
        String cacheKey = cacheService.generateCacheKey("segment", funnelId,
                bound(periodStart), bound(periodEnd), segmentDimension);
        
        return execute("segment", funnelId,
                () -> cacheService.getList(cacheKey, SegmentBucket.class),
                () -> {
                    FunnelDefinition definition = definitionService.getFunnel(funnelId);
                    return engine.segments(definition, loadEvents(funnelId, period), period.getStart(), period.getEnd(),
                            segmentDimension, deadline(timeout));
                },
                result -> cacheService.set(cacheKey, result, properties.getCache().getSegmentTtlSeconds()));
    }
    
    /**
     * Runs the overall analysis without touching the cache.
     */
    @Transactional(readOnly = true)
    FunnelAnalysisResult computeAnalysis(UUID funnelId, AnalysisPeriod period, Duration timeout) {
        FunnelDefinition definition = definitionService.getFunnel(funnelId);
        return engine.analyze(definition, loadEvents(funnelId, period), period.getStart(), period.getEnd(),
                deadline(timeout));
    }
    
    private List<RawEvent> loadEvents(UUID funnelId, AnalysisPeriod period) {
        List<RawEvent> events = eventRepository.findEventsInPeriod(funnelId, period.getStart(), period.getEnd())
                .stream()
                .map(mapper::toRawEvent)
                .toList();
        log.debug("Loaded {} events for funnel {} in [{}, {}]", events.size(), funnelId, period.getStart(), period.getEnd());
        return events;
    }
    
    private <T> T execute(String type,
                          UUID funnelId,
                          Supplier<Optional<T>> cacheLookup,
                          Supplier<T> computation,
                          Consumer<T> cacheStore) {
        Timer.Sample sample = Timer.start(meterRegistry);
        
        try {
            Optional<T> cached = cacheLookup.get();
            
            if (cached.isPresent()) {
                log.debug("Cache hit for {} of funnel {}", type, funnelId);
                
                Counter.builder("funnel.analysis.cache")
                        .tag("result", "hit")
                        .tag("type", type)
                        .register(meterRegistry)
                        .increment();
                
                return cached.get();
            }
            
            // Cache miss - compute from the event snapshot
            Counter.builder("funnel.analysis.cache")
                    .tag("result", "miss")
                    .tag("type", type)
                    .register(meterRegistry)
                    .increment();
            
            long startTime = System.currentTimeMillis();
            T result = computation.get();
            long elapsed = System.currentTimeMillis() - startTime;
            
            cacheStore.accept(result);
            
            sample.stop(Timer.builder("funnel.analysis.latency")
                    .tag("type", type)
                    .tag("cached", "false")
                    .register(meterRegistry));
            
            Counter.builder("funnel.analysis.executed")
                    .tag("type", type)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
            log.info("Funnel {} {} computed in {} ms", funnelId, type, elapsed);
            return result;
        
        } catch (FunnelAnalysisException e) {
            log.warn("Funnel {} {} rejected: {} ({})", funnelId, type, e.getMessage(), e.getKind());
            
            Counter.builder("funnel.analysis.executed")
                    .tag("type", type)
                    .tag("result", e.getKind().name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry)
                    .increment();
            
            throw e;
        
        } catch (RuntimeException e) {
            log.error("Error executing funnel {} {}: {}", funnelId, type, e.getMessage(), e);
            
            Counter.builder("funnel.analysis.executed")
                    .tag("type", type)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            
            throw new IllegalStateException("Funnel " + type + " failed", e);
        }
    }
    
    private static Object bound(Instant requested) {
        return requested != null ? requested : DEFAULT_BOUND;
    }
    
    private static Instant deadline(Duration timeout) {
        return Instant.now().plus(timeout);
    }
}
