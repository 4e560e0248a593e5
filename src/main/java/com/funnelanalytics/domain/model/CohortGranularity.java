package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.FunnelAnalysisException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.Locale;

/** Truncation applied to a session's entry time to pick its cohort. Labels are UTC. */
public enum CohortGranularity {

    DAY {
        @Override
        public String label(Instant entryTime) {
            return utcDate(entryTime).toString();
        }
    },
    WEEK {
        @Override
        public String label(Instant entryTime) {
            LocalDate date = utcDate(entryTime);
            return String.format("%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR),
                    date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    },
    MONTH {
        @Override
        public String label(Instant entryTime) {
            LocalDate date = utcDate(entryTime);
            return String.format("%d-%02d", date.getYear(), date.getMonthValue());
        }
    };
    
    public abstract String label(Instant entryTime);
    
    public static CohortGranularity fromName(String name) {
        if (name == null || name.isBlank()) {
            return DAY;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw FunnelAnalysisException.invalidRequest("Unknown cohort granularity: " + name);
        }
    }
    
    private static LocalDate utcDate(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
