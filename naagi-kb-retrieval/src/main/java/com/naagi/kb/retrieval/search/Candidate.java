package com.naagi.kb.retrieval.search;

/**
 * One chunk returned by a retrieval leg, with the leg's own relevance score.
 */
public record Candidate(
        String chunkId,
        String docId,
        String text,
        String title,
        String url,
        String sourceSystem,
        String spaceKey,
        String doctype,
        double score
) {}
