package com.naagi.kb.embed.load;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record EmbedRunSummary(
        @JsonProperty("run_id") String runId,
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("dimension") int dimension,
        @JsonProperty("total_chunks") int totalChunks,
        @JsonProperty("skipped_skiplist") int skippedBySkipList,
        @JsonProperty("skipped_unchanged") int skippedUnchanged,
        @JsonProperty("embedded") int embedded,
        @JsonProperty("inserted") int inserted,
        @JsonProperty("batches") int batches,
        @JsonProperty("failed_batches") List<FailedBatch> failedBatches,
        @JsonProperty("stopped") boolean stopped,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("duration_ms") long durationMs
) {

    public EmbedRunSummary {
        failedBatches = failedBatches == null ? List.of() : List.copyOf(failedBatches);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return !failedBatches.isEmpty();
    }
}
