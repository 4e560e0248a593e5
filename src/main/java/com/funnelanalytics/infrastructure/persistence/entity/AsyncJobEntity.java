package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity for tracking async funnel analysis jobs.
 *
 * Callers poll this table for job status and results.
 */
@Entity
@Table(name = "analysis_jobs", indexes = {
    @Index(name = "idx_job_status", columnList = "status"),
    @Index(name = "idx_job_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AsyncJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobType jobType;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String jobParams;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;
    
    @Column(columnDefinition = "TEXT")
    private String result;
    
    @Column(length = 50)
    private String errorKind;
    
    @Column(length = 500)
    private String errorMessage;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    @Column
    private Instant startedAt;
    
    @Column
    private Instant completedAt;
    
    public enum JobType {
        ANALYSIS,
        COHORT,
        SEGMENT
    }
    
    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
    
    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
    
    public void markStarted() {
        this.status = JobStatus.RUNNING;
        this.startedAt = Instant.now();
    }
    
    public void markCompleted(String result) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.completedAt = Instant.now();
    }
    
    public void markFailed(String kind, String error) {
        this.status = JobStatus.FAILED;
        this.errorKind = kind;
        this.errorMessage = truncate(error);
        this.completedAt = Instant.now();
    }
    
    public void markCancelled(String error) {
        this.status = JobStatus.CANCELLED;
        this.errorKind = "ANALYSIS_CANCELLED";
        this.errorMessage = truncate(error);
        this.completedAt = Instant.now();
    }
    
    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
    
    private static String truncate(String message) {
        if (message == null || message.length() <= 500) {
            return message;
        }
        return message.substring(0, 500);
    }
}
