package com.naagi.kb.retrieval.pack;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hits rendered into one text block within a character budget.
 */
public record PackedContext(
        @JsonProperty("budget_chars") int budgetChars,
        @JsonProperty("text") String text,
        @JsonProperty("chunks_included") int chunksIncluded,
        @JsonProperty("truncated") boolean truncated
) {

    @JsonProperty("chars")
    public int chars() {
        return text.length();
    }
}
