package com.funnelanalytics.infrastructure.persistence.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelDefinitionEntity;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Converts between JPA entities and domain models. JSON columns go through Jackson.
 */
@Component
@RequiredArgsConstructor
public class FunnelEntityMapper {

    private static final TypeReference<List<FunnelStep>> STEPS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> PROPERTIES_TYPE = new TypeReference<>() {
    };
    
    private final ObjectMapper objectMapper;
    
    public FunnelDefinition toDefinition(FunnelDefinitionEntity entity) {
        return FunnelDefinition.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .steps(readJson(entity.getSteps(), STEPS_TYPE))
                .maxStepInterval(entity.getMaxStepIntervalSeconds() == null
                        ? null
                        : Duration.ofSeconds(entity.getMaxStepIntervalSeconds()))
                .trackingEnabled(entity.isTrackingEnabled())
                .build();
    }
    
    /** Copies the definition's editable fields onto the entity. */
    public void updateEntity(FunnelDefinition definition, FunnelDefinitionEntity entity) {
        entity.setName(definition.getName());
        entity.setDescription(definition.getDescription());
        entity.setSteps(writeJson(definition.getSteps()));
        entity.setMaxStepIntervalSeconds(definition.getMaxStepInterval() == null
                ? null
                : definition.getMaxStepInterval().getSeconds());
        entity.setTrackingEnabled(definition.isTrackingEnabled());
    }
    
    public FunnelDefinitionEntity toEntity(FunnelDefinition definition) {
        FunnelDefinitionEntity entity = new FunnelDefinitionEntity();
        entity.setId(definition.getId());
        updateEntity(definition, entity);
        return entity;
    }
    
    public RawEvent toRawEvent(FunnelEventEntity entity) {
        Map<String, String> attributes = entity.getProperties() == null
                ? Map.of()
                : readJson(entity.getProperties(), PROPERTIES_TYPE);
        return RawEvent.builder()
                .sessionId(entity.getSessionId())
                .eventType(entity.getEventType())
                .timestamp(entity.getTimestamp())
                .attributes(attributes)
                .sequence(entity.getId())
                .build();
    }
    
    public String writeProperties(Map<String, String> properties) {
        return properties == null || properties.isEmpty() ? null : writeJson(properties);
    }
    
    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON could not be read: " + e.getOriginalMessage(), e);
        }
    }
    
    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value could not be written as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
