package com.naagi.kb.retrieval.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Quality signals for one result set. {@code pass} and {@code failureReasons} are filled only
 * when the report was evaluated against thresholds.
 */
public record HealthReport(
        @JsonProperty("total_hits") int totalHits,
        @JsonProperty("unique_docs") int uniqueDocs,
        @JsonProperty("doc_diversity") double docDiversity,
        @JsonProperty("tie_rate") double tieRate,
        @JsonProperty("duplication_rate") double duplicationRate,
        @JsonProperty("traceability") TraceabilityStats traceability,
        @JsonProperty("pass") Boolean pass,
        @JsonProperty("failure_reasons") List<String> failureReasons
) {}
