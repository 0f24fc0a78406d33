package com.naagi.kb.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.naagi.kb.retrieval.health.HealthReport;
import com.naagi.kb.retrieval.pack.PackedContext;

import java.util.List;

public record RetrievalResponse(
        @JsonProperty("query_id") String queryId,
        @JsonProperty("query_text") String queryText,
        @JsonProperty("expanded_query") String expandedQuery,
        @JsonProperty("domain_query") boolean domainQuery,
        @JsonProperty("provider") String provider,
        @JsonProperty("hybrid_enabled") boolean hybridEnabled,
        @JsonProperty("hits") List<RetrievalHit> hits,
        @JsonProperty("contexts") List<PackedContext> contexts,
        @JsonProperty("health") HealthReport health,
        @JsonProperty("duration_ms") long durationMs
) {}
