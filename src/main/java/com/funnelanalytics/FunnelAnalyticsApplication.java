package com.funnelanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Funnel Conversion Analytics Backend
 *
 * Tracks visitor events against ordered funnel definitions and reports how sessions move
 * through the steps.
 *
 * Architecture:
 * - REST APIs for funnel definitions, event tracking and analyses
 * - Parallel step matching across session shards under a per-request deadline
 * - Overall, cohort (by entry date) and segment (by visitor attribute) breakdowns
 * - Redis caching of analysis results behind a circuit breaker
 * - Async job processing for long-running analyses
 * - Stored per-step metrics per period
 */
@SpringBootApplication
@EnableScheduling
public class FunnelAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunnelAnalyticsApplication.class, args);
    }
}
