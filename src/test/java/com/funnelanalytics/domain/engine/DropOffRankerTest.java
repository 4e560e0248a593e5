package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.DropOffPoint;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.domain.model.Session;
import com.funnelanalytics.domain.model.SessionJourney;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.funnelanalytics.domain.engine.FunnelFixtures.T0;
import static com.funnelanalytics.domain.engine.FunnelFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

class DropOffRankerTest {

    private final DropOffRanker dropOffRanker = new DropOffRanker();
    private final StepMatcher stepMatcher = new StepMatcher();
    
    @Test
    void testRank_LargestDropOffFirst() {
        FunnelDefinition funnel = FunnelFixtures.signupFunnel();
        StepTally tally = tally(funnel, FunnelFixtures.hundredFortyTen());
        
        List<DropOffPoint> points = dropOffRanker.rank(funnel, tally, 5);
        
        assertEquals(2, points.size());
        assertEquals("SignUp", points.get(0).getStep());
        assertEquals(60, points.get(0).getDropOffCount());
        assertEquals(60.0, points.get(0).getDropOffRate(), 1e-9);
        assertEquals("Purchase", points.get(1).getStep());
        assertEquals(30, points.get(1).getDropOffCount());
        assertEquals(75.0, points.get(1).getDropOffRate(), 1e-9);
    }
    
    @Test
    void testRank_TiesGoToEarlierStep() {
        // 4 enter, 2 reach step 1, 0 reach step 2: both steps lose 2
        FunnelDefinition funnel = FunnelFixtures.signupFunnel();
        List<RawEvent> events = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            events.add(event("s" + i, "page_view", T0));
            if (i < 2) {
                events.add(event("s" + i, "signup", T0.plusSeconds(1)));
            }
        }
        
        List<DropOffPoint> points = dropOffRanker.rank(funnel, tally(funnel, events), 5);
        
        assertEquals(List.of(1, 2), points.stream().map(DropOffPoint::getStepNumber).toList());
    }
    
    @Test
    void testRank_SkipsStepsWithoutLossesAndHonorsLimit() {
        FunnelDefinition funnel = FunnelFixtures.signupFunnel();
        StepTally tally = tally(funnel, FunnelFixtures.hundredFortyTen());
        
        assertEquals(1, dropOffRanker.rank(funnel, tally, 1).size());
        assertTrue(dropOffRanker.rank(funnel, new StepTally(3), 5).isEmpty());
        assertTrue(dropOffRanker.topDropOffStep(funnel, new StepTally(3)).isEmpty());
        assertEquals("SignUp", dropOffRanker.topDropOffStep(funnel, tally).orElseThrow());
    }
    
    private StepTally tally(FunnelDefinition funnel, List<RawEvent> events) {
        List<Session> sessions = new SessionBuilder().build(events, T0, T0.plusSeconds(3600));
        List<SessionJourney> journeys = sessions.stream().map(s -> stepMatcher.match(s, funnel)).toList();
        return StepTally.of(funnel.stepCount(), journeys);
    }
}
