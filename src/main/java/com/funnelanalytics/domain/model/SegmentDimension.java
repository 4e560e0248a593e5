package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.UnknownSegmentDimensionException;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Session attributes a funnel can be segmented by.
 *
 * Each dimension reads its own attribute of the session's first event.
 */
public enum SegmentDimension {

    BROWSER(attributes -> attributes.get("browser")),
    DEVICE(attributes -> attributes.get("device")),
    SOURCE(attributes -> attributes.getOrDefault("source", attributes.get("utm_source"))),
    LOCATION(attributes -> attributes.getOrDefault("location", attributes.get("country")));
    
    public static final String UNKNOWN_SEGMENT = "Unknown";
    
    private final Function<Map<String, String>, String> extractor;
    
    SegmentDimension(Function<Map<String, String>, String> extractor) {
        this.extractor = extractor;
    }
    
    public String segmentOf(Map<String, String> entryAttributes) {
        String value = extractor.apply(entryAttributes);
        return value == null || value.isBlank() ? UNKNOWN_SEGMENT : value;
    }
    
    public static SegmentDimension fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownSegmentDimensionException(String.valueOf(name));
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownSegmentDimensionException(name);
        }
    }
}
