package com.naagi.kb.retrieval.query;

import java.util.List;

/**
 * Outcome of classifying one query.
 *
 * @param expanded the text sent to both retrieval legs; equals {@code original} for non-domain queries
 * @param topics   names of the profile topics whose keywords occurred in the query
 */
public record QueryAnalysis(String original, String expanded, boolean domainQuery, List<String> topics) {}
