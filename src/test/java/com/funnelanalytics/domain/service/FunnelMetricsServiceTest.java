package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.StepAggregate;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FunnelMetricsServiceTest {

    private static final Instant START = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-02-29T00:00:00Z");
    
    @Mock
    private FunnelAnalysisService analysisService;
    
    @Mock
    private FunnelDefinitionService definitionService;
    
    @Mock
    private FunnelMetricsRepository metricsRepository;
    
    private FunnelMetricsService metricsService;
    private final UUID funnelId = UUID.randomUUID();
    
    @BeforeEach
    void setUp() {
        metricsService = new FunnelMetricsService(analysisService, definitionService, metricsRepository,
                new FunnelProperties());
    }
    
    @Test
    void testCalculateMetrics_UpsertsOneRowPerStep() {
        // Given - step 0 already has a row for this period
        FunnelMetricsEntity existing = FunnelMetricsEntity.builder()
                .id(UUID.randomUUID())
                .funnelId(funnelId)
                .stepNumber(0)
                .period("2024-02-01")
                .totalCount(1)
                .build();
        FunnelAnalysisResult analysis = FunnelAnalysisResult.builder()
                .funnelId(funnelId)
                .steps(List.of(
                        StepAggregate.builder().step("Landing").stepNumber(0).totalUsers(100).conversionRate(100).build(),
                        StepAggregate.builder().step("SignUp").stepNumber(1).totalUsers(40).conversionRate(40)
                                .dropOffRate(60).build()))
                .build();
        
        when(analysisService.computeAnalysis(eq(funnelId), any(AnalysisPeriod.class), any())).thenReturn(analysis);
        when(metricsRepository.findByFunnelIdAndStepNumberAndPeriod(funnelId, 0, "2024-02-01"))
                .thenReturn(Optional.of(existing));
        when(metricsRepository.findByFunnelIdAndStepNumberAndPeriod(funnelId, 1, "2024-02-01"))
                .thenReturn(Optional.empty());
        when(metricsRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        
        // When
        List<FunnelMetricsEntity> saved = metricsService.calculateMetrics(funnelId, START, END);
        
        // Then
        assertEquals(2, saved.size());
        assertSame(existing, saved.get(0));
        assertEquals(100, existing.getTotalCount());
        assertEquals(60.0, saved.get(1).getDropOffRate());
        assertEquals("2024-02-01", saved.get(1).getPeriod());
        assertEquals(END, saved.get(1).getPeriodEnd());
    }
    
    @Test
    void testGetFunnelMetrics_AllPeriodsWhenNoneGiven() {
        metricsService.getFunnelMetrics(funnelId, null);
        metricsService.getFunnelMetrics(funnelId, "2024-02-01");
        
        verify(metricsRepository).findByFunnelIdOrderByPeriodDescStepNumberAsc(funnelId);
        verify(metricsRepository).findByFunnelIdAndPeriodOrderByStepNumberAsc(funnelId, "2024-02-01");
        verify(definitionService, times(2)).getFunnel(funnelId);
    }
    
    @Test
    void testPeriodKeyIsUtcDate() {
        assertEquals("2024-02-01", FunnelMetricsService.periodKey(Instant.parse("2024-02-01T23:59:59Z")));
    }
}
