package com.funnelanalytics.domain.exception;

/** Analysis ran past its deadline or its thread was interrupted; no partial result is returned. */
public class AnalysisCancelledException extends FunnelAnalysisException {

    public AnalysisCancelledException(String message) {
        super(ErrorKind.ANALYSIS_CANCELLED, message);
    }
    
    public AnalysisCancelledException(String message, Throwable cause) {
        super(ErrorKind.ANALYSIS_CANCELLED, message, cause);
    }
}
