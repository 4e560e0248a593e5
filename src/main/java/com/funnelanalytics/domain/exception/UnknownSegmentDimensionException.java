package com.funnelanalytics.domain.exception;

import lombok.Getter;

@Getter
public class UnknownSegmentDimensionException extends FunnelAnalysisException {

    private final String dimension;
    
    public UnknownSegmentDimensionException(String dimension) {
        super(ErrorKind.UNKNOWN_SEGMENT_DIMENSION, "Unknown segment dimension: " + dimension);
        this.dimension = dimension;
    }
}
