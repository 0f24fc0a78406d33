package com.naagi.kb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A contiguous, token-bounded span of one document's normalized text.
 * <p>
 * {@code charStart}/{@code charEnd} index the normalized body text. Designed overlap
 * with the previous chunk of the same document is the only case where spans intersect.
 */
public record Chunk(
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("doc_id") String docId,
        @JsonProperty("ordinal") int ordinal,
        @JsonProperty("text") String text,
        @JsonProperty("token_count") int tokenCount,
        @JsonProperty("char_start") int charStart,
        @JsonProperty("char_end") int charEnd,
        @JsonProperty("chunk_type") ChunkType chunkType,
        @JsonProperty("split_strategy") String splitStrategy,
        @JsonProperty("traceability") Traceability traceability,
        @JsonProperty("meta") Map<String, Object> meta
) {

    public Chunk {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static String chunkId(String docId, int ordinal) {
        return String.format("%s:%04d", docId, ordinal);
    }
}
