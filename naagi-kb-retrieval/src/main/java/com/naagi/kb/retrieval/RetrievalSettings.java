package com.naagi.kb.retrieval;

import java.util.List;

/**
 * Defaults applied to any retrieval request field left unset.
 */
public record RetrievalSettings(
        int topK,
        int rrfK,
        int topkDense,
        int topkBm25,
        int maxChunksPerDoc,
        boolean hybridEnabled,
        boolean boostsEnabled,
        boolean domainFilterEnabled,
        List<String> spaceWhitelist,
        int snippetChars
) {

    public static final int MAX_TOP_K = 100;

    public RetrievalSettings {
        spaceWhitelist = spaceWhitelist == null ? List.of() : List.copyOf(spaceWhitelist);
    }

    public static RetrievalSettings defaults() {
        return new RetrievalSettings(8, 60, 200, 200, 3, true, true, false, List.of(), 300);
    }
}
