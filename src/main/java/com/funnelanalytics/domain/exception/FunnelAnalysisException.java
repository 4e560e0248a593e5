package com.funnelanalytics.domain.exception;

import lombok.Getter;

/**
 * Base error for funnel operations.
 *
 * The kind lets callers tell validation, lookup and cancellation failures apart.
 */
@Getter
public class FunnelAnalysisException extends RuntimeException {

    private final ErrorKind kind;
    
    public FunnelAnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public FunnelAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public static FunnelAnalysisException invalidRequest(String message) {
        return new FunnelAnalysisException(ErrorKind.INVALID_ANALYSIS_REQUEST, message);
    }
}
