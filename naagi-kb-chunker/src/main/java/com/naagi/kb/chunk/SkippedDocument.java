package com.naagi.kb.chunk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SkippedDocument(
        @JsonProperty("doc_id") String docId,
        @JsonProperty("reason") String reason
) {}
