package com.naagi.kb.core.event;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records events that could not be emitted, so observability failures stay visible
 * without failing the pipeline that produced them.
 */
public class EmitFailureChannel {

    private static final int MAX_RETAINED = 100;

    public record EmitFailure(Instant at, String event, String runId, String error) {}

    private final Deque<EmitFailure> recent = new ArrayDeque<>();
    private final AtomicLong total = new AtomicLong();

    public void record(KbEvent event, Throwable error) {
        total.incrementAndGet();
        EmitFailure failure = new EmitFailure(Instant.now(), event.event(), event.runId(),
                error.getClass().getSimpleName() + ": " + error.getMessage());
        synchronized (recent) {
            recent.addLast(failure);
            if (recent.size() > MAX_RETAINED) {
                recent.removeFirst();
            }
        }
    }

    public long count() {
        return total.get();
    }

    public List<EmitFailure> recent() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }
}
