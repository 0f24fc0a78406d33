package com.naagi.kb.core.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryEventSink implements EventSink {

    private final List<KbEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(KbEvent event) {
        events.add(event);
    }

    public List<KbEvent> events() {
        return List.copyOf(events);
    }

    public List<KbEvent> named(String name) {
        return events.stream()
                .filter(e -> e.event().equals(name))
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
