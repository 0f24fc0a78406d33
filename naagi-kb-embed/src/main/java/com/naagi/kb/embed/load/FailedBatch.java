package com.naagi.kb.embed.load;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A batch that could not be embedded after retries. Listed in the run summary for targeted retry.
 */
public record FailedBatch(
        @JsonProperty("batch_index") int batchIndex,
        @JsonProperty("chunk_ids") List<String> chunkIds,
        @JsonProperty("doc_ids") List<String> docIds,
        @JsonProperty("error") String error
) {}
