package com.naagi.kb.retrieval.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion: {@code RRF(d) = sum 1 / (k + rank(d))} over the legs {@code d} appears in,
 * with 1-based ranks. A leg that does not contain {@code d} contributes nothing.
 */
public class RrfFusion {

    private static final Logger log = LoggerFactory.getLogger(RrfFusion.class);

    /** Final score descending, then chunk id ascending. */
    public static final Comparator<FusedCandidate> ORDER = Comparator.comparingDouble(FusedCandidate::finalScore).reversed()
            .thenComparing(FusedCandidate::chunkId);

    private final int k;

    public RrfFusion(int k) {
        if (k < 1) throw new IllegalArgumentException("rrf k must be >= 1");
        this.k = k;
    }

    public List<FusedCandidate> fuse(List<Candidate> dense, List<Candidate> lexical) {
        Map<String, Candidate> byId = new LinkedHashMap<>();
        Map<String, Integer> denseRanks = new LinkedHashMap<>();
        Map<String, Integer> bm25Ranks = new LinkedHashMap<>();

        for (int i = 0; i < dense.size(); i++) {
            Candidate c = dense.get(i);
            byId.putIfAbsent(c.chunkId(), c);
            denseRanks.putIfAbsent(c.chunkId(), i + 1);
        }
        for (int i = 0; i < lexical.size(); i++) {
            Candidate c = lexical.get(i);
            byId.putIfAbsent(c.chunkId(), c);
            bm25Ranks.putIfAbsent(c.chunkId(), i + 1);
        }

        List<FusedCandidate> out = new ArrayList<>(byId.size());
        byId.forEach((id, c) -> {
            Integer dr = denseRanks.get(id);
            Integer br = bm25Ranks.get(id);
            double score = (dr == null ? 0.0 : 1.0 / (k + dr)) + (br == null ? 0.0 : 1.0 / (k + br));
            out.add(new FusedCandidate(c, dr, br, score, 0.0));
        });
        out.sort(ORDER);

        if (log.isDebugEnabled()) {
            long both = out.stream().filter(f -> f.denseRank() != null && f.bm25Rank() != null).count();
            log.debug("RRF fusion: {} candidates (both={}, dense={}, bm25={})",
                    out.size(), both, denseRanks.size(), bm25Ranks.size());
        }
        return out;
    }
}
