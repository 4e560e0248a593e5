package com.funnelanalytics.api;

import com.funnelanalytics.domain.model.AnalysisJobRequest;
import com.funnelanalytics.domain.model.CohortBucket;
import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.FunnelUpdateRequest;
import com.funnelanalytics.domain.model.SegmentBucket;
import com.funnelanalytics.domain.model.TrackEventRequest;
import com.funnelanalytics.domain.service.AsyncJobProcessor;
import com.funnelanalytics.domain.service.FunnelAnalysisService;
import com.funnelanalytics.domain.service.FunnelDefinitionService;
import com.funnelanalytics.domain.service.FunnelMetricsService;
import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelMetricsEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for funnels.
 *
 * Endpoints:
 * - POST/GET/PUT/DELETE /api/v1/funnels[/{id}] - Funnel definitions
 * - POST /api/v1/funnels/presets - Create the built-in funnel templates
 * - POST /api/v1/funnels/events - Track a visitor event
 * - GET /api/v1/funnels/{id}/analysis[/export] - Overall analysis (JSON or CSV)
 * - GET /api/v1/funnels/{id}/cohort-analysis - Completion by entry date
 * - GET /api/v1/funnels/{id}/segment-analysis - Completion by visitor attribute
 * - POST/GET /api/v1/funnels/{id}/metrics - Stored per-step metrics
 * - POST /api/v1/funnels/jobs, GET /api/v1/funnels/jobs/{jobId} - Async analysis jobs
 *
 * Periods are ISO 8601 instants. Missing bounds default to the last 30 days.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/funnels")
@RequiredArgsConstructor
public class FunnelController {

    private final FunnelDefinitionService definitionService;
    private final FunnelAnalysisService analysisService;
    private final FunnelMetricsService metricsService;
    private final AsyncJobProcessor asyncJobProcessor;
    private final FunnelReportExporter reportExporter;
    
    @PostMapping
    public ResponseEntity<FunnelDefinition> createFunnel(@Valid @RequestBody FunnelRequest request) {
        log.info("Create funnel: name={}", request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(definitionService.createFunnel(request));
    }
    
    @GetMapping
    public ResponseEntity<List<FunnelDefinition>> getFunnels() {
        return ResponseEntity.ok(definitionService.getFunnels());
    }
    
    @GetMapping("/{funnelId}")
    public ResponseEntity<FunnelDefinition> getFunnel(@PathVariable UUID funnelId) {
        return ResponseEntity.ok(definitionService.getFunnel(funnelId));
    }
    
    @PutMapping("/{funnelId}")
    public ResponseEntity<FunnelDefinition> updateFunnel(@PathVariable UUID funnelId,
                                                         @Valid @RequestBody FunnelUpdateRequest request) {
        log.info("Update funnel: funnelId={}", funnelId);
        return ResponseEntity.ok(definitionService.updateFunnel(funnelId, request));
    }
    
    @DeleteMapping("/{funnelId}")
    public ResponseEntity<Void> deleteFunnel(@PathVariable UUID funnelId) {
        log.info("Delete funnel: funnelId={}", funnelId);
        definitionService.deleteFunnel(funnelId);
        return ResponseEntity.noContent().build();
    }
    
    @PostMapping("/presets")
    public ResponseEntity<List<FunnelDefinition>> createPresetFunnels() {
        log.info("Create preset funnels");
        return ResponseEntity.status(HttpStatus.CREATED).body(definitionService.createPresetFunnels());
    }
    
    /**
     * Track a visitor event.
     *
     * POST /api/v1/funnels/events
     *
     * Request body:
     * {
     *   "funnelId": "uuid",
     *   "sessionId": "s-1",
     *   "eventType": "page_view",
     *   "timestamp": "2024-01-01T10:00:00Z",
     *   "properties": { "browser": "Chrome" }
     * }
     */
    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> trackEvent(@Valid @RequestBody TrackEventRequest request) {
        FunnelEventEntity event = definitionService.trackEvent(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("eventId", event.getId(), "timestamp", event.getTimestamp()));
    }
    
    @GetMapping("/{funnelId}/analysis")
    public ResponseEntity<FunnelAnalysisResult> analyzeFunnel(
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        
        log.info("Analyze funnel: funnelId={}, startDate={}, endDate={}", funnelId, startDate, endDate);
        return ResponseEntity.ok(analysisService.analyzeFunnel(funnelId, startDate, endDate));
    }
    
    @GetMapping("/{funnelId}/analysis/export")
    public ResponseEntity<String> exportAnalysis(
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        
        FunnelAnalysisResult result = analysisService.analyzeFunnel(funnelId, startDate, endDate);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"funnel-" + funnelId + ".csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(reportExporter.toCsv(result));
    }
    
    /**
     * GET /api/v1/funnels/{id}/cohort-analysis?cohortBy=day|week|month
     */
    @GetMapping("/{funnelId}/cohort-analysis")
    public ResponseEntity<List<CohortBucket>> cohortAnalysis(
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "day") String cohortBy) {
        
        log.info("Cohort analysis: funnelId={}, cohortBy={}", funnelId, cohortBy);
        return ResponseEntity.ok(analysisService.cohortAnalysis(funnelId, startDate, endDate, cohortBy));
    }
    
    /**
     * GET /api/v1/funnels/{id}/segment-analysis?segmentBy=browser|device|source|location
     */
    @GetMapping("/{funnelId}/segment-analysis")
    public ResponseEntity<List<SegmentBucket>> segmentAnalysis(
            @PathVariable UUID funnelId,
            @RequestParam String segmentBy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        
        log.info("Segment analysis: funnelId={}, segmentBy={}", funnelId, segmentBy);
        return ResponseEntity.ok(analysisService.segmentAnalysis(funnelId, segmentBy, startDate, endDate));
    }
    
    @PostMapping("/{funnelId}/metrics/calculate")
    public ResponseEntity<List<FunnelMetricsEntity>> calculateMetrics(
            @PathVariable UUID funnelId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        
        log.info("Calculate metrics: funnelId={}", funnelId);
        return ResponseEntity.ok(metricsService.calculateMetrics(funnelId, startDate, endDate));
    }
    
    @GetMapping("/{funnelId}/metrics")
    public ResponseEntity<List<FunnelMetricsEntity>> getMetrics(@PathVariable UUID funnelId,
                                                               @RequestParam(required = false) String period) {
        return ResponseEntity.ok(metricsService.getFunnelMetrics(funnelId, period));
    }
    
    /**
     * Submit async analysis job.
     *
     * POST /api/v1/funnels/jobs
     *
     * Request body:
     * {
     *   "jobType": "ANALYSIS|COHORT|SEGMENT",
     *   "funnelId": "uuid",
     *   "granularity": "week",
     *   "dimension": "browser"
     * }
     *
     * Response:
     * {
     *   "jobId": "uuid"
     * }
     */
    @PostMapping("/jobs")
    public ResponseEntity<Map<String, UUID>> submitAsyncJob(@Valid @RequestBody AnalysisJobRequest request) {
        log.info("Submit async job: jobType={}, funnelId={}", request.getJobType(), request.getFunnelId());
        
        UUID jobId = asyncJobProcessor.submitAsyncJob(request);
        
        return ResponseEntity.accepted().body(Map.of("jobId", jobId));
    }
    
    /**
     * Get async job status and result.
     *
     * Status: PENDING|RUNNING|COMPLETED|FAILED|CANCELLED
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobEntity> getJobStatus(@PathVariable UUID jobId) {
        log.info("Get job status: jobId={}", jobId);
        return ResponseEntity.ok(asyncJobProcessor.getJobStatus(jobId));
    }
}
