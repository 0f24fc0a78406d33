package com.naagi.kb.embed.preflight;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Contents of {@code doc_skiplist.json}. */
public record SkipList(
        @JsonProperty("run_id") String runId,
        @JsonProperty("min_quality") double minQuality,
        @JsonProperty("doc_ids") List<String> docIds
) {}
