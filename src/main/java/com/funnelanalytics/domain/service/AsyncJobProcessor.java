package com.funnelanalytics.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.config.FunnelProperties;
import com.funnelanalytics.domain.exception.AnalysisCancelledException;
import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import com.funnelanalytics.domain.model.AnalysisJobRequest;
import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import com.funnelanalytics.infrastructure.persistence.repository.AsyncJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Async job processor for long-running funnel analyses.
 *
 * 1. Caller submits an analysis job → job created with PENDING status
 * 2. Caller receives the job ID immediately
 * 3. Background worker picks up the job and runs it under the job deadline
 * 4. Caller polls for job status and result
 *
 * A job that hits its deadline ends CANCELLED, other failures end FAILED with the error kind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobProcessor {

    private final AsyncJobRepository asyncJobRepository;
    private final FunnelAnalysisService analysisService;
    private final FunnelDefinitionService definitionService;
    private final FunnelProperties properties;
    private final ObjectMapper objectMapper;
    
    /**
     * Submit async analysis job. Returns job ID immediately.
     */
    @Transactional
    public UUID submitAsyncJob(AnalysisJobRequest request) {
        // Reject unknown funnels up front instead of failing in the worker
        definitionService.getFunnel(request.getFunnelId());
        
        try {
            AsyncJobEntity job = AsyncJobEntity.builder()
                    .jobType(request.getJobType())
                    .jobParams(objectMapper.writeValueAsString(request))
                    .build();
            
            job = asyncJobRepository.save(job);
            
            log.info("Async job submitted: {} (type: {}, funnel: {})", job.getJobId(), request.getJobType(), request.getFunnelId());
            
            return job.getJobId();
        
        } catch (Exception e) {
            log.error("Error submitting async job: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to submit async job", e);
        }
    }
    
    /**
     * Get job status and result.
     */
    @Transactional(readOnly = true)
    public AsyncJobEntity getJobStatus(UUID jobId) {
        return asyncJobRepository.findById(jobId)
                .orElseThrow(() -> FunnelAnalysisException.invalidRequest("Job not found: " + jobId));
    }
    
    /**
     * Process pending jobs. Runs every second.
     */
    @Scheduled(fixedDelayString = "${app.funnel.jobs.poll-interval-ms:1000}")
    public void processPendingJobs() {
        try {
            List<AsyncJobEntity> pendingJobs = asyncJobRepository.findByStatusOrderByCreatedAtAsc(
                    AsyncJobEntity.JobStatus.PENDING,
                    PageRequest.of(0, properties.getJobs().getBatchSize()));
            
            if (pendingJobs.isEmpty()) {
                return;
            }
            
            log.debug("Processing {} pending async jobs", pendingJobs.size());
            
            for (AsyncJobEntity job : pendingJobs) {
                processJob(job);
            }
        
        } catch (Exception e) {
            log.error("Error processing pending jobs: {}", e.getMessage(), e);
        }
    }
    
    void processJob(AsyncJobEntity job) {
        try {
            log.info("Processing async job: {} (type: {})", job.getJobId(), job.getJobType());
            
            job.markStarted();
            asyncJobRepository.save(job);
            
            AnalysisJobRequest request = objectMapper.readValue(job.getJobParams(), AnalysisJobRequest.class);
            Duration timeout = properties.getAnalysis().getJobTimeout();
            
            Object result = switch (job.getJobType()) {
                case ANALYSIS -> analysisService.analyzeFunnel(
                        request.getFunnelId(), request.getPeriodStart(), request.getPeriodEnd(), timeout);
                case COHORT -> analysisService.cohortAnalysis(
                        request.getFunnelId(), request.getPeriodStart(), request.getPeriodEnd(),
                        request.getGranularity(), timeout);
                case SEGMENT -> analysisService.segmentAnalysis(
                        request.getFunnelId(), request.getDimension(), request.getPeriodStart(),
                        request.getPeriodEnd(), timeout);
            };
            
            job.markCompleted(objectMapper.writeValueAsString(result));
            asyncJobRepository.save(job);
            
            log.info("Async job completed: {} ({} ms)", job.getJobId(), job.getExecutionTimeMs());
        
        } catch (AnalysisCancelledException e) {
            log.warn("Async job {} cancelled: {}", job.getJobId(), e.getMessage());
            
            job.markCancelled(e.getMessage());
            asyncJobRepository.save(job);
        
        } catch (FunnelAnalysisException e) {
            log.warn("Async job {} rejected: {}", job.getJobId(), e.getMessage());
            
            job.markFailed(e.getKind().name(), e.getMessage());
            asyncJobRepository.save(job);
        
        } catch (Exception e) {
            log.error("Error processing async job {}: {}", job.getJobId(), e.getMessage(), e);
            
            job.markFailed("INTERNAL_ERROR", e.getMessage());
            asyncJobRepository.save(job);
        }
    }
}
