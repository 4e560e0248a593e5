package com.funnelanalytics.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.engine.FunnelAnalysisEngine;
import com.funnelanalytics.domain.exception.AnalysisCancelledException;
import com.funnelanalytics.domain.exception.ErrorKind;
import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import com.funnelanalytics.domain.exception.UnknownSegmentDimensionException;
import com.funnelanalytics.domain.model.CohortBucket;
import com.funnelanalytics.domain.model.CohortGranularity;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.infrastructure.cache.AnalysisCacheService;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import com.funnelanalytics.infrastructure.persistence.mapper.FunnelEntityMapper;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FunnelAnalysisService.
 *
 * Tests caching behavior, period defaults and error propagation.
 */
@ExtendWith(MockitoExtension.class)
class FunnelAnalysisServiceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-31T00:00:00Z");
    
    @Mock
    private FunnelDefinitionService definitionService;
    
    @Mock
    private FunnelEventRepository eventRepository;
    
    @Mock
    private FunnelAnalysisEngine engine;
    
    @Mock
    private AnalysisCacheService cacheService;
    
    private MeterRegistry meterRegistry;
    private FunnelProperties properties;
    private FunnelAnalysisService analysisService;
    
    private final UUID funnelId = UUID.randomUUID();
    private final FunnelDefinition funnel = FunnelDefinition.builder().id(funnelId).name("Signup").build();
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new FunnelProperties();
        analysisService = new FunnelAnalysisService(definitionService, eventRepository,
                new FunnelEntityMapper(new ObjectMapper()), engine, cacheService, properties, meterRegistry);
    }
    
    @Test
    void testAnalyzeFunnel_CacheHit() {
        // Given
        FunnelAnalysisResult cached = FunnelAnalysisResult.builder()
                .funnelId(funnelId)
                .totalSessions(42)
                .build();
        
        when(cacheService.get(any(), eq(FunnelAnalysisResult.class))).thenReturn(Optional.of(cached));
        
        // When
        FunnelAnalysisResult result = analysisService.analyzeFunnel(funnelId, START, END);
        
        // Then
        assertSame(cached, result);
        
        // Verify nothing was loaded or computed (cache hit)
        verify(eventRepository, never()).findEventsInPeriod(any(), any(), any());
        verifyNoInteractions(engine);
        assertEquals(1.0, meterRegistry.get("funnel.analysis.cache").tag("result", "hit").counter().count());
    }
    
    @Test
    void testAnalyzeFunnel_CacheMiss() {
        // Given
        FunnelEventEntity stored = FunnelEventEntity.builder()
                .id(7L)
                .funnelId(funnelId)
                .sessionId("s-1")
                .eventType("page_view")
                .properties("{\"browser\":\"Chrome\"}")
                .timestamp(START.plusSeconds(60))
                .build();
        FunnelAnalysisResult computed = FunnelAnalysisResult.builder().funnelId(funnelId).totalSessions(1).build();
        
        when(cacheService.get(any(), eq(FunnelAnalysisResult.class))).thenReturn(Optional.empty());
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(eventRepository.findEventsInPeriod(funnelId, START, END)).thenReturn(List.of(stored));
        when(engine.analyze(eq(funnel), anyCollection(), eq(START), eq(END), any())).thenReturn(computed);
        
        // When
        FunnelAnalysisResult result = analysisService.analyzeFunnel(funnelId, START, END);
        
        // Then
        assertSame(computed, result);
        
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RawEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(engine).analyze(eq(funnel), events.capture(), eq(START), eq(END), any());
        RawEvent event = events.getValue().get(0);
        assertEquals(7L, event.getSequence());
        assertEquals("Chrome", event.attribute("browser"));
        
        // Verify result was cached with the analysis TTL
        verify(cacheService).set(any(), eq(computed), eq(300L));
        assertEquals(1.0, meterRegistry.get("funnel.analysis.executed").tag("result", "success").counter().count());
    }
    
    @Test
    void testCohortAnalysis_UsesGranularityAndCohortTtl() {
        List<CohortBucket> buckets = List.of(CohortBucket.builder().cohortDate("2024-W01").totalUsers(3).build());
        
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(eventRepository.findEventsInPeriod(funnelId, START, END)).thenReturn(List.of());
        when(engine.cohorts(eq(funnel), anyCollection(), eq(START), eq(END), eq(CohortGranularity.WEEK), any()))
                .thenReturn(buckets);
        
        List<CohortBucket> result = analysisService.cohortAnalysis(funnelId, START, END, "week");
        
        assertEquals(buckets, result);
        verify(cacheService).set(any(), eq(buckets), eq(3600L));
    }
    
    @Test
    void testSegmentAnalysis_UnknownDimensionFailsBeforeAnyWork() {
        assertThrows(UnknownSegmentDimensionException.class,
                () -> analysisService.segmentAnalysis(funnelId, "favorite_color", START, END));
        
        verifyNoInteractions(cacheService, eventRepository, engine);
    }
    
    @Test
    void testAnalyzeFunnel_StartAfterEnd() {
        FunnelAnalysisException e = assertThrows(FunnelAnalysisException.class,
                () -> analysisService.analyzeFunnel(funnelId, END, START));
        
        assertEquals(ErrorKind.INVALID_ANALYSIS_REQUEST, e.getKind());
        verifyNoInteractions(engine);
    }
    
    @Test
    void testAnalyzeFunnel_DefaultPeriodIsLookbackFromNow() {
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(engine.analyze(eq(funnel), anyCollection(), any(), any(), any()))
                .thenReturn(FunnelAnalysisResult.builder().build());
        
        analysisService.analyzeFunnel(funnelId, null, null);
        
        ArgumentCaptor<Instant> start = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> end = ArgumentCaptor.forClass(Instant.class);
        verify(eventRepository).findEventsInPeriod(eq(funnelId), start.capture(), end.capture());
        assertEquals(properties.getAnalysis().getDefaultLookback(),
                Duration.between(start.getValue(), end.getValue()));
    }
    
    @Test
    void testAnalyzeFunnel_DefaultPeriodCallsShareOneCacheEntry() {
        String key = "funnel:analysis:" + funnelId + ":default:default";
        FunnelAnalysisResult computed = FunnelAnalysisResult.builder().funnelId(funnelId).totalSessions(5).build();
        
        when(cacheService.generateCacheKey("analysis", funnelId,
                FunnelAnalysisService.DEFAULT_BOUND, FunnelAnalysisService.DEFAULT_BOUND)).thenReturn(key);
        when(cacheService.get(key, FunnelAnalysisResult.class))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(computed));
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(engine.analyze(eq(funnel), anyCollection(), any(), any(), any())).thenReturn(computed);
        
        FunnelAnalysisResult first = analysisService.analyzeFunnel(funnelId, null, null);
        FunnelAnalysisResult second = analysisService.analyzeFunnel(funnelId, null, null);
        
        assertSame(computed, first);
        assertSame(computed, second);
        verify(cacheService, times(2)).get(key, FunnelAnalysisResult.class);
        verify(cacheService).set(key, computed, 300L);
        verify(engine, times(1)).analyze(any(), anyCollection(), any(), any(), any());
    }
    
    @Test
    void testAnalyzeFunnel_CancellationIsRethrownAndNotCached() {
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(engine.analyze(eq(funnel), anyCollection(), any(), any(), any()))
                .thenThrow(new AnalysisCancelledException("deadline"));
        
        assertThrows(AnalysisCancelledException.class, () -> analysisService.analyzeFunnel(funnelId, START, END));
        
        verify(cacheService, never()).set(any(), any(), anyLong());
        assertEquals(1.0, meterRegistry.get("funnel.analysis.executed")
                .tag("result", "analysis_cancelled").counter().count());
    }
    
    @Test
    void testAnalyzeFunnel_UnexpectedErrorIsWrapped() {
        when(definitionService.getFunnel(funnelId)).thenReturn(funnel);
        when(eventRepository.findEventsInPeriod(any(), any(), any())).thenThrow(new RuntimeException("db down"));
        
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> analysisService.analyzeFunnel(funnelId, START, END));
        
        assertEquals("db down", e.getCause().getMessage());
    }
}
