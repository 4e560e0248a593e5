package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.engine.FunnelDefinitionValidator;
import com.funnelanalytics.domain.exception.ErrorKind;
import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import com.funnelanalytics.domain.exception.FunnelNotFoundException;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.FunnelStep;
import com.funnelanalytics.domain.model.FunnelUpdateRequest;
import com.funnelanalytics.domain.model.MatchPredicate;
import com.funnelanalytics.domain.model.TrackEventRequest;
import com.funnelanalytics.infrastructure.cache.AnalysisCacheService;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelDefinitionEntity;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import com.funnelanalytics.infrastructure.persistence.mapper.FunnelEntityMapper;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelDefinitionRepository;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelEventRepository;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelMetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Funnel definitions and event tracking.
 *
 * Definitions are validated on every write. Updating or deleting a funnel drops its cached analyses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelDefinitionService {

    private final FunnelDefinitionRepository definitionRepository;
    private final FunnelEventRepository eventRepository;
    private final FunnelMetricsRepository metricsRepository;
    private final FunnelDefinitionValidator validator;
    private final FunnelEntityMapper mapper;
    private final AnalysisCacheService cacheService;
    
    @Transactional
    public FunnelDefinition createFunnel(FunnelRequest request) {
        FunnelDefinition definition = validator.normalize(FunnelDefinition.builder()
                .name(request.getName())
                .description(request.getDescription())
                .steps(request.getSteps())
                .maxStepInterval(toDuration(request.getMaxStepIntervalSeconds()))
                .trackingEnabled(request.getTrackingEnabled() == null || request.getTrackingEnabled())
                .build());
        
        FunnelDefinitionEntity saved = definitionRepository.save(mapper.toEntity(definition));
        log.info("Created funnel {} ({} steps)", saved.getId(), definition.stepCount());
        return mapper.toDefinition(saved);
    }
    
    @Transactional(readOnly = true)
    public List<FunnelDefinition> getFunnels() {
        return definitionRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(mapper::toDefinition)
                .toList();
    }
    
    @Transactional(readOnly = true)
    public FunnelDefinition getFunnel(UUID funnelId) {
        return mapper.toDefinition(findEntity(funnelId));
    }
    
    @Transactional
    public FunnelDefinition updateFunnel(UUID funnelId, FunnelUpdateRequest request) {
        FunnelDefinitionEntity entity = findEntity(funnelId);
        FunnelDefinition current = mapper.toDefinition(entity);
        
        FunnelDefinition.FunnelDefinitionBuilder updated = current.toBuilder();
        if (request.getName() != null) {
            updated.name(request.getName());
        }
        if (request.getDescription() != null) {
            updated.description(request.getDescription());
        }
        if (request.getSteps() != null) {
            updated.steps(request.getSteps());
        }
        if (request.getMaxStepIntervalSeconds() != null) {
            updated.maxStepInterval(toDuration(request.getMaxStepIntervalSeconds()));
        }
        if (request.getTrackingEnabled() != null) {
            updated.trackingEnabled(request.getTrackingEnabled());
        }
        
        FunnelDefinition definition = validator.normalize(updated.build());
        mapper.updateEntity(definition, entity);
        FunnelDefinitionEntity saved = definitionRepository.save(entity);
        
        cacheService.invalidateFunnel(funnelId);
        log.info("Updated funnel {}", funnelId);
        return mapper.toDefinition(saved);
    }
    
    @Transactional
    public void deleteFunnel(UUID funnelId) {
        FunnelDefinitionEntity entity = findEntity(funnelId);
        
        eventRepository.deleteByFunnelId(funnelId);
        metricsRepository.deleteByFunnelId(funnelId);
        definitionRepository.delete(entity);
        
        cacheService.invalidateFunnel(funnelId);
        log.info("Deleted funnel {}", funnelId);
    }
    
    /**
     * Stores a visitor event. Rejected when the funnel is unknown or has tracking disabled.
     */
    @Transactional
    public FunnelEventEntity trackEvent(TrackEventRequest request) {
        FunnelDefinitionEntity funnel = findEntity(request.getFunnelId());
        if (!funnel.isTrackingEnabled()) {
            throw new FunnelAnalysisException(ErrorKind.INVALID_ANALYSIS_REQUEST,
                    "Tracking is disabled for funnel " + funnel.getId());
        }
        
        FunnelEventEntity event = FunnelEventEntity.builder()
                .funnelId(funnel.getId())
                .sessionId(request.getSessionId())
                .eventType(request.getEventType())
                .timestamp(request.getTimestamp())
                .properties(mapper.writeProperties(request.getProperties()))
                .build();
        
        FunnelEventEntity saved = eventRepository.save(event);
        log.debug("Tracked event {} for funnel {} session {}", saved.getEventType(), funnel.getId(), saved.getSessionId());
        return saved;
    }
    
    /**
     * Creates the built-in funnel templates. Steps match on event type.
     */
    @Transactional
    public List<FunnelDefinition> createPresetFunnels() {
        List<FunnelDefinition> created = new ArrayList<>();
        created.add(createFunnel(preset("Support Ticket Creation",
                "Track customer journey from issue discovery to ticket submission",
                "Help Center Visit", "Search Articles", "Click Contact Support", "Fill Ticket Form", "Submit Ticket")));
        created.add(createFunnel(preset("Customer Subscription",
                "Track subscription signup flow",
                "View Pricing Page", "Select Plan", "Enter Account Details", "Add Payment Method", "Complete Subscription")));
        created.add(createFunnel(preset("Feature Adoption",
                "Track new feature discovery and adoption",
                "Feature Announcement", "View Feature Page", "Start Feature Setup", "Configure Feature", "First Feature Use")));
        
        log.info("Created {} preset funnels", created.size());
        return created;
    }
    
    private FunnelDefinitionEntity findEntity(UUID funnelId) {
        return definitionRepository.findById(funnelId)
                .orElseThrow(() -> new FunnelNotFoundException(funnelId));
    }
    
    private static FunnelRequest preset(String name, String description, String... stepNames) {
        List<FunnelStep> steps = new ArrayList<>(stepNames.length);
        for (int i = 0; i < stepNames.length; i++) {
            steps.add(FunnelStep.builder()
                    .name(stepNames[i])
                    .order(i)
                    .predicate(MatchPredicate.eventType(toEventType(stepNames[i])))
                    .build());
        }
        return FunnelRequest.builder()
                .name(name)
                .description(description)
                .steps(steps)
                .build();
    }
    
    // "Help Center Visit" -> "help_center_visit"
    static String toEventType(String stepName) {
        return stepName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }
    
    private static Duration toDuration(Long seconds) {
        return seconds == null ? null : Duration.ofSeconds(seconds);
    }
}
