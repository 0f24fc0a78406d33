package com.naagi.kb.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked result. {@code fusedScore} is the RRF score plus {@code boost}; ranks are 1-based
 * and null for a leg the chunk was not found by.
 */
public record RetrievalHit(
        @JsonProperty("rank") int rank,
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("doc_id") String docId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("source_system") String sourceSystem,
        @JsonProperty("snippet") String snippet,
        @JsonProperty("dense_rank") Integer denseRank,
        @JsonProperty("bm25_rank") Integer bm25Rank,
        @JsonProperty("rrf_score") double rrfScore,
        @JsonProperty("boost") double boost,
        @JsonProperty("fused_score") double fusedScore
) {}
