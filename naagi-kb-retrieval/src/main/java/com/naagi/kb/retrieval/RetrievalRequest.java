package com.naagi.kb.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Retrieval query. Every field except {@code query_text} is optional and falls back to
 * {@link RetrievalSettings}.
 */
public record RetrievalRequest(
        @JsonProperty("query_text") String queryText,
        @JsonProperty("top_k") Integer topK,
        @JsonProperty("budgets") List<Integer> budgets,
        @JsonProperty("provider") String provider,
        @JsonProperty("dimension") Integer dimension,
        @JsonProperty("hybrid_enabled") Boolean hybridEnabled,
        @JsonProperty("rrf_k") Integer rrfK,
        @JsonProperty("topk_dense") Integer topkDense,
        @JsonProperty("topk_bm25") Integer topkBm25,
        @JsonProperty("boosts_enabled") Boolean boostsEnabled,
        @JsonProperty("domain_filter_enabled") Boolean domainFilterEnabled,
        @JsonProperty("space_whitelist") List<String> spaceWhitelist,
        @JsonProperty("max_chunks_per_doc") Integer maxChunksPerDoc
) {

    public static RetrievalRequest of(String queryText, int topK) {
        return new RetrievalRequest(queryText, topK, null, null, null, null, null, null, null, null, null, null, null);
    }

    public RetrievalRequest withBudgets(List<Integer> value) {
        return new RetrievalRequest(queryText, topK, value, provider, dimension, hybridEnabled, rrfK, topkDense,
                topkBm25, boostsEnabled, domainFilterEnabled, spaceWhitelist, maxChunksPerDoc);
    }

    public RetrievalRequest withHybridEnabled(boolean value) {
        return new RetrievalRequest(queryText, topK, budgets, provider, dimension, value, rrfK, topkDense,
                topkBm25, boostsEnabled, domainFilterEnabled, spaceWhitelist, maxChunksPerDoc);
    }

    public RetrievalRequest withBoostsEnabled(boolean value) {
        return new RetrievalRequest(queryText, topK, budgets, provider, dimension, hybridEnabled, rrfK, topkDense,
                topkBm25, value, domainFilterEnabled, spaceWhitelist, maxChunksPerDoc);
    }

    public RetrievalRequest withSpaceWhitelist(List<String> value) {
        return new RetrievalRequest(queryText, topK, budgets, provider, dimension, hybridEnabled, rrfK, topkDense,
                topkBm25, boostsEnabled, domainFilterEnabled, value, maxChunksPerDoc);
    }

    public RetrievalRequest withDomainFilterEnabled(boolean value) {
        return new RetrievalRequest(queryText, topK, budgets, provider, dimension, hybridEnabled, rrfK, topkDense,
                topkBm25, boostsEnabled, value, spaceWhitelist, maxChunksPerDoc);
    }

    /**
     * Copy with every unset field taken from {@code d}. Budgets stay empty when not requested.
     */
    public RetrievalRequest withDefaults(RetrievalSettings d) {
        return new RetrievalRequest(
                queryText,
                topK != null ? topK : d.topK(),
                budgets != null ? List.copyOf(budgets) : List.of(),
                provider,
                dimension,
                hybridEnabled != null ? hybridEnabled : d.hybridEnabled(),
                rrfK != null ? rrfK : d.rrfK(),
                topkDense != null ? topkDense : d.topkDense(),
                topkBm25 != null ? topkBm25 : d.topkBm25(),
                boostsEnabled != null ? boostsEnabled : d.boostsEnabled(),
                domainFilterEnabled != null ? domainFilterEnabled : d.domainFilterEnabled(),
                spaceWhitelist != null ? List.copyOf(spaceWhitelist) : d.spaceWhitelist(),
                maxChunksPerDoc != null ? maxChunksPerDoc : d.maxChunksPerDoc());
    }

    /**
     * @throws IllegalArgumentException naming the first invalid field
     */
    public void validate() {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query_text is required");
        }
        if (topK != null && (topK < 1 || topK > RetrievalSettings.MAX_TOP_K)) {
            throw new IllegalArgumentException("top_k must be between 1 and " + RetrievalSettings.MAX_TOP_K);
        }
        if (rrfK != null && rrfK < 1) {
            throw new IllegalArgumentException("rrf_k must be >= 1");
        }
        if (topkDense != null && topkDense < 1) {
            throw new IllegalArgumentException("topk_dense must be >= 1");
        }
        if (topkBm25 != null && topkBm25 < 1) {
            throw new IllegalArgumentException("topk_bm25 must be >= 1");
        }
        if (maxChunksPerDoc != null && maxChunksPerDoc < 1) {
            throw new IllegalArgumentException("max_chunks_per_doc must be >= 1");
        }
        if (dimension != null && dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        if (budgets != null && budgets.stream().anyMatch(b -> b == null || b <= 0)) {
            throw new IllegalArgumentException("budgets must be positive character counts");
        }
    }
}
