package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.StepAggregate;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Stored per-step funnel metrics.
 *
 * A calculation overwrites the rows of the same (funnel, step, period), where period is the
 * UTC date of the period start.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelMetricsService {

    private final FunnelAnalysisService analysisService;
    private final FunnelDefinitionService definitionService;
    private final FunnelMetricsRepository metricsRepository;
    private final FunnelProperties properties;
    
    @Transactional
    public List<FunnelMetricsEntity> calculateMetrics(UUID funnelId, Instant periodStart, Instant periodEnd) {
        AnalysisPeriod period = AnalysisPeriod.resolve(periodStart, periodEnd, properties.getAnalysis().getDefaultLookback());
        FunnelAnalysisResult analysis = analysisService.computeAnalysis(funnelId, period,
                properties.getAnalysis().getTimeout());
        String periodKey = periodKey(period.getStart());
        
        List<FunnelMetricsEntity> saved = new ArrayList<>(analysis.getSteps().size());
        for (StepAggregate step : analysis.getSteps()) {
            FunnelMetricsEntity metrics = metricsRepository
                    .findByFunnelIdAndStepNumberAndPeriod(funnelId, step.getStepNumber(), periodKey)
                    .orElseGet(() -> FunnelMetricsEntity.builder()
                            .funnelId(funnelId)
                            .stepNumber(step.getStepNumber())
                            .period(periodKey)
                            .build());
            
            metrics.setStep(step.getStep());
            metrics.setTotalCount(step.getTotalUsers());
            metrics.setConversionRate(step.getConversionRate());
            metrics.setDropOffRate(step.getDropOffRate());
            metrics.setAvgTimeToNext(step.getAvgTimeToNext());
            metrics.setAvgTimeFromStart(step.getAvgTimeFromStart());
            metrics.setPeriodStart(period.getStart());
            metrics.setPeriodEnd(period.getEnd());
            
            saved.add(metricsRepository.save(metrics));
        }
        
        log.info("Calculated metrics for funnel {} period {} ({} steps)", funnelId, periodKey, saved.size());
        return saved;
    }
    
    /**
     * Stored metrics of a funnel, newest period first. A null period returns every period.
     */
    @Transactional(readOnly = true)
    public List<FunnelMetricsEntity> getFunnelMetrics(UUID funnelId, String period) {
        // 404 for unknown funnels rather than an empty list
        definitionService.getFunnel(funnelId);
        
        if (period == null || period.isBlank()) {
            return metricsRepository.findByFunnelIdOrderByPeriodDescStepNumberAsc(funnelId);
        }
        return metricsRepository.findByFunnelIdAndPeriodOrderByStepNumberAsc(funnelId, period);
    }
    
    static String periodKey(Instant periodStart) {
        return periodStart.atOffset(ZoneOffset.UTC).toLocalDate().toString();
    }
}
