package com.naagi.kb.retrieval.search;

import java.util.List;

/**
 * Vector similarity leg.
 */
public interface DenseRetriever {

    /**
     * Up to {@code topK} chunks embedded under {@code provider}, ordered by cosine similarity
     * descending, then doc id, then chunk id.
     */
    List<Candidate> search(String provider, float[] queryVector, int topK, CandidateFilter filter);
}
