package com.funnelanalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** Type-safe settings under app.funnel.* (analysis limits, cache TTLs, job worker). */
@Configuration
@ConfigurationProperties(prefix = "app.funnel")
@Getter
@Setter
public class FunnelProperties {

    private AnalysisProperties analysis = new AnalysisProperties();
    private CacheProperties cache = new CacheProperties();
    private JobProperties jobs = new JobProperties();
    
    @Getter
    @Setter
    public static class AnalysisProperties {
        /** Deadline for a single synchronous analysis. */
        private Duration timeout = Duration.ofSeconds(10);
        /** Deadline for analyses run by the async job worker. */
        private Duration jobTimeout = Duration.ofMinutes(10);
        /** Matcher worker threads. */
        private int parallelism = Runtime.getRuntime().availableProcessors();
        /** Sessions matched per worker task. */
        private int shardSize = 500;
        /** Lookback used when a request has no period start. */
        private Duration defaultLookback = Duration.ofDays(30);
        private int dropOffLimit = 5;
    }
    
    @Getter
    @Setter
    public static class CacheProperties {
        private long analysisTtlSeconds = 300;
        private long cohortTtlSeconds = 3600;
        private long segmentTtlSeconds = 3600;
    }
    
    @Getter
    @Setter
    public static class JobProperties {
        /** Pending jobs picked up per poll. */
        private int batchSize = 10;
        private long pollIntervalMs = 1000;
    }
}
