package com.funnelanalytics.domain.exception;

public enum ErrorKind {
    INVALID_FUNNEL_DEFINITION,
    UNKNOWN_SEGMENT_DIMENSION,
    INVALID_ANALYSIS_REQUEST,
    ANALYSIS_CANCELLED,
    FUNNEL_NOT_FOUND
}
