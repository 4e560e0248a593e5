package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.exception.InvalidFunnelDefinitionException;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.MatchPredicate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects funnel definitions the engine cannot analyze.
 *
 * Rules:
 * - at least 2 steps
 * - step orders unique and contiguous from 0
 * - every step named and carrying a complete predicate
 * - time-box, when present, strictly positive
 */
@Component
public class FunnelDefinitionValidator {

    public static final int MIN_STEPS = 2;
    
    public void validate(FunnelDefinition definition) {
        List<String> violations = new ArrayList<>();
        
        List<FunnelStep> steps = definition.getSteps();
        if (steps == null || steps.size() < MIN_STEPS) {
            violations.add("Funnel must have at least " + MIN_STEPS + " steps");
            throw new InvalidFunnelDefinitionException(violations);
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) == null) {
                violations.add("Step at position " + i + " is missing");
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidFunnelDefinitionException(violations);
        }
        
        List<FunnelStep> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingInt(FunnelStep::getOrder));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getOrder() != i) {
                violations.add("Steps must have sequential order starting from 0, found "
                        + sorted.stream().map(s -> String.valueOf(s.getOrder())).toList());
                break;
            }
        }
        
        for (FunnelStep step : steps) {
            if (step.getName() == null || step.getName().isBlank()) {
                violations.add("Step " + step.getOrder() + " has no name");
            }
            checkPredicate(step, violations);
        }
        
        if (definition.getMaxStepInterval() != null
                && (definition.getMaxStepInterval().isNegative() || definition.getMaxStepInterval().isZero())) {
            violations.add("maxStepInterval must be positive");
        }
        
        if (!violations.isEmpty()) {
            throw new InvalidFunnelDefinitionException(violations);
        }
    }
    
    /**
     * Validates and returns a copy of the definition whose steps are sorted by order.
     */
    public FunnelDefinition normalize(FunnelDefinition definition) {
        validate(definition);
        List<FunnelStep> sorted = new ArrayList<>(definition.getSteps());
        sorted.sort(Comparator.comparingInt(FunnelStep::getOrder));
        return definition.toBuilder()
                .steps(List.copyOf(sorted))
                .build();
    }
    
    private void checkPredicate(FunnelStep step, List<String> violations) {
        MatchPredicate predicate = step.getPredicate();
        if (predicate == null || predicate.getKind() == null) {
            violations.add("Step " + step.getOrder() + " has no match predicate");
            return;
        }
        if (predicate.getValue() == null) {
            violations.add("Step " + step.getOrder() + " predicate has no value");
            return;
        }
        if (predicate.getKind().requiresProperty()
                && (predicate.getProperty() == null || predicate.getProperty().isBlank())) {
            violations.add("Step " + step.getOrder() + " predicate " + predicate.getKind() + " needs a property");
        }
        if (predicate.getKind() == MatchPredicate.Kind.PROPERTY_MATCHES) {
            try {
                Pattern.compile(predicate.getValue());
            } catch (PatternSyntaxException e) {
                violations.add("Step " + step.getOrder() + " has an invalid pattern: " + e.getDescription());
            }
        }
    }
}
