package com.naagi.kb.embed.preflight;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Preflight over several runs: which may be embedded and why the others may not.
 */
public record PlanReport(
        @JsonProperty("ready") List<String> ready,
        @JsonProperty("blocked") Map<String, List<PreflightReason>> blocked,
        @JsonProperty("embeddable_docs") int embeddableDocs,
        @JsonProperty("total_chunks") int totalChunks
) {}
