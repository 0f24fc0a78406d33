package com.naagi.kb.retrieval.search;

/**
 * A candidate after rank fusion. Ranks are 1-based and null for a leg the chunk was absent from.
 */
public record FusedCandidate(
        Candidate candidate,
        Integer denseRank,
        Integer bm25Rank,
        double rrfScore,
        double boost
) {

    public double finalScore() {
        return rrfScore + boost;
    }

    public String chunkId() {
        return candidate.chunkId();
    }

    public String docId() {
        return candidate.docId();
    }

    public FusedCandidate withBoost(double value) {
        return new FusedCandidate(candidate, denseRank, bm25Rank, rrfScore, value);
    }
}
