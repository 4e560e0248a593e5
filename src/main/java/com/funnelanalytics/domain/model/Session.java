package com.funnelanalytics.domain.model;

import lombok.Value;

import java.util.List;

/** One visitor's in-window events, sorted by (timestamp, sequence). */
@Value
public class Session {

    String sessionId;
    List<RawEvent> events;
    
    public RawEvent firstEvent() {
        return events.get(0);
    }
}
