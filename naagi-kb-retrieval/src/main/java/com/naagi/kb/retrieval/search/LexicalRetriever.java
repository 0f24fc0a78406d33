package com.naagi.kb.retrieval.search;

import java.util.List;

/**
 * Full-text relevance leg.
 */
public interface LexicalRetriever {

    /**
     * Up to {@code topK} chunks ordered by lexical relevance descending, then doc id, then chunk id.
     */
    List<Candidate> search(String query, int topK, CandidateFilter filter);
}
