package com.funnelanalytics.domain.exception;

import java.util.UUID;

public class FunnelNotFoundException extends FunnelAnalysisException {

    public FunnelNotFoundException(UUID funnelId) {
        super(ErrorKind.FUNNEL_NOT_FOUND, "Funnel not found: " + funnelId);
    }
}
