package com.naagi.kb.retrieval.rank;

import com.naagi.kb.retrieval.search.FusedCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a ranked list and keeps at most {@code maxPerDoc} hits per document, never the same
 * {@code (doc_id, chunk_id)} twice, stopping once {@code limit} hits are selected.
 */
public final class DiversityFilter {

    private DiversityFilter() {}

    public static List<FusedCandidate> select(List<FusedCandidate> ranked, int maxPerDoc, int limit) {
        List<FusedCandidate> out = new ArrayList<>(Math.min(ranked.size(), limit));
        Map<String, Integer> perDoc = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (FusedCandidate c : ranked) {
            if (out.size() >= limit) break;
            if (!seen.add(c.docId() + "\u0000" + c.chunkId())) continue;
            int count = perDoc.getOrDefault(c.docId(), 0);
            if (count >= maxPerDoc) continue;
            perDoc.put(c.docId(), count + 1);
            out.add(c);
        }
        return out;
    }
}
