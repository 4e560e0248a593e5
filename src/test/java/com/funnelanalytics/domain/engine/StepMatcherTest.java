package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.SessionJourney;
import com.funnelanalytics.domain.model.StepReach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.funnelanalytics.domain.engine.FunnelFixtures.T0;
import static com.funnelanalytics.domain.engine.FunnelFixtures.event;
import static com.funnelanalytics.domain.engine.FunnelFixtures.signupFunnel;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StepMatcher.
 *
 * Steps must be reached in order; later steps seen first do not count.
 */
class StepMatcherTest {

    private final StepMatcher stepMatcher = new StepMatcher();
    private final FunnelDefinition funnel = signupFunnel();
    
    @Test
    void testMatch_FullJourney() {
        Session session = new Session("s", List.of(
                event("s", "page_view", T0, Map.of("browser", "Firefox")),
                event("s", "signup", T0.plusSeconds(60)),
                event("s", "purchase", T0.plusSeconds(180))));
        
        SessionJourney journey = stepMatcher.match(session, funnel);
        
        assertEquals(3, journey.reachedSteps());
        assertTrue(journey.completed(3));
        assertEquals(T0, journey.getEntryTime());
        assertEquals("Firefox", journey.getEntryAttributes().get("browser"));
        assertEquals(120_000, journey.millisBetween(1, 2));
    }
    
    @Test
    void testMatch_LaterStepBeforeEarlierStepIsIgnored() {
        // Given - purchase happens before signup
        Session session = new Session("s", List.of(
                event("s", "page_view", T0),
                event("s", "purchase", T0.plusSeconds(10)),
                event("s", "signup", T0.plusSeconds(20))));
        
        // When
        SessionJourney journey = stepMatcher.match(session, funnel);
        
        // Then
        assertEquals(2, journey.reachedSteps());
        assertFalse(journey.completed(3));
    }
    
    @Test
    void testMatch_FirstMatchingEventCounts() {
        Session session = new Session("s", List.of(
                event("s", "page_view", T0),
                event("s", "page_view", T0.plusSeconds(5)),
                event("s", "signup", T0.plusSeconds(30)),
                event("s", "signup", T0.plusSeconds(90))));
        
        SessionJourney journey = stepMatcher.match(session, funnel);
        
        assertEquals(List.of(T0, T0.plusSeconds(30)),
                journey.getReaches().stream().map(StepReach::getTimestamp).toList());
    }
    
    @Test
    void testMatch_NoFirstStep_EntryIsFirstEvent() {
        Session session = new Session("s", List.of(
                event("s", "signup", T0.plusSeconds(7)),
                event("s", "purchase", T0.plusSeconds(8))));
        
        SessionJourney journey = stepMatcher.match(session, funnel);
        
        assertEquals(0, journey.reachedSteps());
        assertEquals(T0.plusSeconds(7), journey.getEntryTime());
    }
    
    @Test
    void testMatch_StepOutsideTimeBoxEndsJourney() {
        FunnelDefinition timeBoxed = funnel.toBuilder().maxStepInterval(Duration.ofMinutes(5)).build();
        Session session = new Session("s", List.of(
                event("s", "page_view", T0),
                event("s", "signup", T0.plusSeconds(300)),
                event("s", "purchase", T0.plusSeconds(901))));
        
        SessionJourney journey = stepMatcher.match(session, timeBoxed);
        
        // signup at exactly 5 minutes still counts, purchase 601s later does not
        assertEquals(2, journey.reachedSteps());
    }
}
