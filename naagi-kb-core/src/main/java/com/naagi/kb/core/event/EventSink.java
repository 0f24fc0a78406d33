package com.naagi.kb.core.event;

/**
 * Destination for pipeline events. Passed explicitly to each component.
 */
public interface EventSink {

    EventSink NOOP = event -> { };

    void emit(KbEvent event);
}
