package com.naagi.kb.core.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured pipeline event, written one per line to a run's event log.
 */
public record KbEvent(
        @JsonProperty("ts") Instant ts,
        @JsonProperty("event") String event,
        @JsonProperty("run_id") String runId,
        @JsonProperty("fields") Map<String, Object> fields
) {

    public static KbEvent of(String event, String runId) {
        return new KbEvent(Instant.now(), event, runId, Map.of());
    }

    public static KbEvent of(String event, String runId, Map<String, Object> fields) {
        return new KbEvent(Instant.now(), event, runId, new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields == null ? null : fields.get(name);
    }
}
