package com.churnguard.intervention.support;

import com.churnguard.common.event.EngineEvent;
import com.churnguard.common.event.InterventionEventPublisher;

import java.util.ArrayList;
import java.util.List;

public class RecordingEventPublisher implements InterventionEventPublisher {

    private final List<EngineEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(EngineEvent event) {
        events.add(event);
    }

    public synchronized List<EngineEvent> events() {
        return List.copyOf(events);
    }

    public synchronized <T extends EngineEvent> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
