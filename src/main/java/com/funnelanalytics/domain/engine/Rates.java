package com.funnelanalytics.domain.engine;

/**
 * Rate and average helpers. A zero denominator yields 0.
 */
public final class Rates {

    private Rates() {
    }
    
    /** part / whole * 100, clamped to [0, 100]. */
    public static double percentage(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        double rate = part * 100.0 / whole;
        return Math.max(0, Math.min(100, rate));
    }
    
    /** Mean of a millisecond total over {@code count} samples, in seconds. */
    public static double meanSeconds(long totalMillis, long count) {
        if (count <= 0) {
            return 0;
        }
        return (double) totalMillis / count / 1000.0;
    }
}
