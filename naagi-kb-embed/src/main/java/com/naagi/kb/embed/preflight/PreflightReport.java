package com.naagi.kb.embed.preflight;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Readiness verdict of one run. {@code belowThresholdPct} is advisory and never blocks.
 */
public record PreflightReport(
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") PreflightStatus status,
        @JsonProperty("reasons") List<PreflightReason> reasons,
        @JsonProperty("embeddable_docs") int embeddableDocs,
        @JsonProperty("total_docs") int totalDocs,
        @JsonProperty("total_chunks") int totalChunks,
        @JsonProperty("below_threshold_pct") double belowThresholdPct,
        @JsonProperty("skip_list") List<String> skipList,
        @JsonProperty("config_problems") List<String> configProblems,
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("dimension") int dimension,
        @JsonProperty("checked_at") Instant checkedAt
) {

    public PreflightReport {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        skipList = skipList == null ? List.of() : List.copyOf(skipList);
        configProblems = configProblems == null ? List.of() : List.copyOf(configProblems);
    }

    @JsonIgnore
    public boolean isReady() {
        return status == PreflightStatus.READY;
    }
}
