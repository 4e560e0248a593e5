package com.funnelanalytics.domain.engine;

import com.funnelanalytics.domain.model.RawEvent;
import com.funnelanalytics.domain.model.Session;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups events into per-session, time-ordered sequences.
 *
 * Only events inside [periodStart, periodEnd] are kept. Output is sorted by sessionId and each
 * session by (timestamp, sequence), so it does not depend on the order events arrived in.
 */
@Component
public class SessionBuilder {

    static final Comparator<RawEvent> EVENT_ORDER = Comparator
            .comparing(RawEvent::getTimestamp)
            .thenComparingLong(RawEvent::getSequence);
    
    public List<Session> build(Collection<RawEvent> events, Instant periodStart, Instant periodEnd) {
        Map<String, List<RawEvent>> bySession = new TreeMap<>();
        for (RawEvent event : events) {
            Instant timestamp = event.getTimestamp();
            if (timestamp.isBefore(periodStart) || timestamp.isAfter(periodEnd)) {
                continue;
            }
            bySession.computeIfAbsent(event.getSessionId(), id -> new ArrayList<>()).add(event);
        }
        
        List<Session> sessions = new ArrayList<>(bySession.size());
        bySession.forEach((sessionId, sessionEvents) -> {
            sessionEvents.sort(EVENT_ORDER);
            sessions.add(new Session(sessionId, List.copyOf(sessionEvents)));
        });
        return sessions;
    }
}
