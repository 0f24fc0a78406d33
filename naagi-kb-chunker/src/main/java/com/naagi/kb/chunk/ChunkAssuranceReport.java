package com.naagi.kb.chunk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.naagi.kb.core.model.Chunk;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-run summary written next to {@code chunks.ndjson}.
 */
public record ChunkAssuranceReport(
        @JsonProperty("run_id") String runId,
        @JsonProperty("tokenizer") String tokenizer,
        @JsonProperty("hard_max_tokens") int hardMaxTokens,
        @JsonProperty("docs_total") int docsTotal,
        @JsonProperty("docs_chunked") int docsChunked,
        @JsonProperty("chunks_total") int chunksTotal,
        @JsonProperty("token_min") int tokenMin,
        @JsonProperty("token_max") int tokenMax,
        @JsonProperty("token_avg") double tokenAvg,
        @JsonProperty("tail_small") int tailSmall,
        @JsonProperty("force_truncated") int forceTruncated,
        @JsonProperty("digests") int digests,
        @JsonProperty("below_hard_min") int belowHardMin,
        @JsonProperty("strategy_counts") Map<String, Integer> strategyCounts,
        @JsonProperty("skipped_docs") List<SkippedDocument> skippedDocs,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt
) {

    /** Accumulates chunk statistics while a run streams through its documents. */
    static final class Builder {
        private final String runId;
        private final String tokenizer;
        private final int hardMaxTokens;
        private final Instant startedAt = Instant.now();
        private final Map<String, Integer> strategies = new TreeMap<>();
        private int docsTotal;
        private int docsChunked;
        private int chunks;
        private int tokenMin = Integer.MAX_VALUE;
        private int tokenMax;
        private long tokenSum;
        private int tailSmall;
        private int forceTruncated;
        private int digests;
        private int belowHardMin;

        Builder(String runId, String tokenizer, int hardMaxTokens) {
            this.runId = runId;
            this.tokenizer = tokenizer;
            this.hardMaxTokens = hardMaxTokens;
        }

        void document(List<Chunk> docChunks) {
            docsTotal++;
            if (!docChunks.isEmpty()) docsChunked++;
            for (Chunk c : docChunks) {
                chunks++;
                tokenMin = Math.min(tokenMin, c.tokenCount());
                tokenMax = Math.max(tokenMax, c.tokenCount());
                tokenSum += c.tokenCount();
                strategies.merge(c.splitStrategy(), 1, Integer::sum);
                if (Boolean.TRUE.equals(c.meta().get("tail_small"))) tailSmall++;
                if (Boolean.TRUE.equals(c.meta().get("force_truncate"))) forceTruncated++;
                if (c.meta().containsKey("digest")) digests++;
                if (c.meta().containsKey("below_hard_min_reason")) belowHardMin++;
            }
        }

        void skipped() {
            docsTotal++;
        }

        ChunkAssuranceReport build(List<SkippedDocument> skippedDocs) {
            return new ChunkAssuranceReport(runId, tokenizer, hardMaxTokens, docsTotal, docsChunked, chunks,
                    chunks == 0 ? 0 : tokenMin, tokenMax, chunks == 0 ? 0.0 : (double) tokenSum / chunks,
                    tailSmall, forceTruncated, digests, belowHardMin, Map.copyOf(strategies),
                    List.copyOf(skippedDocs), startedAt, Instant.now());
        }
    }
}
