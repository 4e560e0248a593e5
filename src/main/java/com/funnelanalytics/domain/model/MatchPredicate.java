package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * Condition an event must satisfy to count as a funnel step.
 *
 * Exactly one kind per step:
 * - EVENT_TYPE_EQUALS: event type equals {@code value}
 * - PROPERTY_EQUALS: attribute {@code property} equals {@code value}
 * - PROPERTY_CONTAINS: attribute {@code property} contains {@code value}
 * - PROPERTY_MATCHES: attribute {@code property} matches the regex {@code value}
 */
@Data
@NoArgsConstructor
public class MatchPredicate {

    private Kind kind;
    private String property;
    private String value;
    
    // Compiled once per predicate, shared by the matcher threads
    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    private transient volatile Pattern pattern;
    
    @Builder
    public MatchPredicate(Kind kind, String property, String value) {
        this.kind = kind;
        this.property = property;
        this.value = value;
    }
    
    public enum Kind {
        EVENT_TYPE_EQUALS,
        PROPERTY_EQUALS,
        PROPERTY_CONTAINS,
        PROPERTY_MATCHES;
        
        public boolean requiresProperty() {
            return this != EVENT_TYPE_EQUALS;
        }
    }
    
    public static MatchPredicate eventType(String eventType) {
        return new MatchPredicate(Kind.EVENT_TYPE_EQUALS, null, eventType);
    }
    
    public static MatchPredicate propertyEquals(String property, String value) {
        return new MatchPredicate(Kind.PROPERTY_EQUALS, property, value);
    }
    
    public static MatchPredicate propertyContains(String property, String value) {
        return new MatchPredicate(Kind.PROPERTY_CONTAINS, property, value);
    }
    
    public static MatchPredicate propertyMatches(String property, String regex) {
        return new MatchPredicate(Kind.PROPERTY_MATCHES, property, regex);
    }
    
    public boolean matches(RawEvent event) {
        return switch (kind) {
            case EVENT_TYPE_EQUALS -> value.equals(event.getEventType());
            case PROPERTY_EQUALS -> value.equals(event.attribute(property));
            case PROPERTY_CONTAINS -> {
                String attribute = event.attribute(property);
                yield attribute != null && attribute.contains(value);
            }
            case PROPERTY_MATCHES -> {
                String attribute = event.attribute(property);
                yield attribute != null && compiledPattern().matcher(attribute).matches();
            }
        };
    }
    
    private Pattern compiledPattern() {
        Pattern compiled = pattern;
        if (compiled == null) {
            compiled = Pattern.compile(value);
            pattern = compiled;
        }
        return compiled;
    }
}
