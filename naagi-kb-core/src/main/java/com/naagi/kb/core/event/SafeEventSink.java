package com.naagi.kb.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a sink so emission failures never reach the caller; they are logged and
 * recorded on an {@link EmitFailureChannel} instead.
 */
public final class SafeEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(SafeEventSink.class);

    private final EventSink delegate;
    private final EmitFailureChannel failures;

    public SafeEventSink(EventSink delegate, EmitFailureChannel failures) {
        this.delegate = delegate;
        this.failures = failures;
    }

    @Override
    public void emit(KbEvent event) {
        try {
            delegate.emit(event);
        } catch (RuntimeException e) {
            failures.record(event, e);
            log.warn("Event emission failed for {} (run={}): {}", event.event(), event.runId(), e.getMessage());
        }
    }

    public EmitFailureChannel failures() {
        return failures;
    }
}
