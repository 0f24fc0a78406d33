package com.naagi.kb.core.event;

/**
 * Supplies the event sink a run's components should write to.
 */
@FunctionalInterface
public interface EventSinkFactory {

    EventSink forRun(String runId);
}
