package com.funnelanalytics.domain.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidFunnelDefinitionException extends FunnelAnalysisException {

    private final List<String> violations;
    
    public InvalidFunnelDefinitionException(List<String> violations) {
        super(ErrorKind.INVALID_FUNNEL_DEFINITION, "Invalid funnel definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
