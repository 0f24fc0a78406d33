package com.naagi.kb.retrieval.health;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TraceabilityStats(
        @JsonProperty("missing_title") int missingTitle,
        @JsonProperty("missing_url") int missingUrl,
        @JsonProperty("missing_source_system") int missingSourceSystem,
        @JsonProperty("total_hits") int totalHits,
        @JsonProperty("complete_hits") int completeHits
) {}
