package com.naagi.kb.chunk;

/**
 * Token limits and merge switches for the chunker.
 *
 * @param hardMaxTokens      no chunk may exceed this many tokens
 * @param overlapTokens      trailing context copied into the next piece when a level splits
 * @param softMinTokens      glue pass target: smaller chunks are merged into a neighbour when possible
 * @param hardMinTokens      chunks may stay below this only with a recorded reason
 * @param preferHeadings     use the document's section map before markdown headings
 * @param orphanHeadingMerge merge heading-only chunks into the following chunk
 * @param smallTailMerge     merge a small last chunk into its predecessor
 * @param minCoverage        fraction of the normalized text that chunk spans must cover
 */
public record ChunkingParams(
        int hardMaxTokens,
        int overlapTokens,
        int softMinTokens,
        int hardMinTokens,
        boolean preferHeadings,
        boolean orphanHeadingMerge,
        boolean smallTailMerge,
        double minCoverage
) {
    public static final int DEFAULT_HARD_MAX_TOKENS = 800;
    public static final int DEFAULT_OVERLAP_TOKENS = 60;
    public static final int DEFAULT_SOFT_MIN_TOKENS = 200;
    public static final int DEFAULT_HARD_MIN_TOKENS = 80;
    public static final double DEFAULT_MIN_COVERAGE = 0.995;

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_HARD_MAX_TOKENS, DEFAULT_OVERLAP_TOKENS, DEFAULT_SOFT_MIN_TOKENS,
                DEFAULT_HARD_MIN_TOKENS, true, true, true, DEFAULT_MIN_COVERAGE);
    }

    public ChunkingParams withHardMaxTokens(int value) {
        return new ChunkingParams(value, overlapTokens, softMinTokens, hardMinTokens,
                preferHeadings, orphanHeadingMerge, smallTailMerge, minCoverage);
    }

    public ChunkingParams withOverlapTokens(int value) {
        return new ChunkingParams(hardMaxTokens, value, softMinTokens, hardMinTokens,
                preferHeadings, orphanHeadingMerge, smallTailMerge, minCoverage);
    }

    public ChunkingParams withMinTokens(int softMin, int hardMin) {
        return new ChunkingParams(hardMaxTokens, overlapTokens, softMin, hardMin,
                preferHeadings, orphanHeadingMerge, smallTailMerge, minCoverage);
    }

    public void validate() {
        if (hardMaxTokens <= 0) {
            throw new IllegalArgumentException("hardMaxTokens must be positive");
        }
        if (overlapTokens < 0 || overlapTokens >= hardMaxTokens) {
            throw new IllegalArgumentException("overlapTokens must be in [0, hardMaxTokens)");
        }
        if (hardMinTokens < 0 || softMinTokens < hardMinTokens || softMinTokens > hardMaxTokens) {
            throw new IllegalArgumentException("expected 0 <= hardMinTokens <= softMinTokens <= hardMaxTokens");
        }
        if (minCoverage <= 0 || minCoverage > 1) {
            throw new IllegalArgumentException("minCoverage must be in (0, 1]");
        }
    }
}
