package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** Inclusive analysis window with request defaults applied. */
@Value
class AnalysisPeriod {

    Instant start;
    Instant end;
    
    /**
     * Missing end defaults to now, missing start to {@code end - defaultLookback}.
     */
    static AnalysisPeriod resolve(Instant periodStart, Instant periodEnd, Duration defaultLookback) {
        Instant end = periodEnd != null ? periodEnd : Instant.now();
        Instant start = periodStart != null ? periodStart : end.minus(defaultLookback);
        if (start.isAfter(end)) {
            throw FunnelAnalysisException.invalidRequest(
                    "periodStart " + start + " is after periodEnd " + end);
        }
        return new AnalysisPeriod(start, end);
    }
}
