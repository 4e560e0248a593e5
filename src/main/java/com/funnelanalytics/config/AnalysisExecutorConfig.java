package com.funnelanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for per-session step matching.
 *
 * Threads are daemons named funnel-matcher-N, apart from the Spring scheduling pool.
 */
@Slf4j
@Configuration
public class AnalysisExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService funnelAnalysisExecutor(FunnelProperties properties) {
        int threads = Math.max(1, properties.getAnalysis().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "funnel-matcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Funnel analysis executor started with {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
