package com.naagi.kb.retrieval.health;

import com.naagi.kb.retrieval.RetrievalHit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Diversity, tie, duplication and traceability metrics over a list of hits.
 */
public final class RetrievalHealth {

    private RetrievalHealth() {}

    public static HealthReport measure(List<RetrievalHit> hits) {
        return new HealthReport(hits.size(), uniqueDocs(hits), docDiversity(hits), tieRate(hits),
                duplicationRate(hits), traceability(hits), null, null);
    }

    /**
     * Measures {@code hits} and checks them against the given thresholds.
     */
    public static HealthReport evaluate(List<RetrievalHit> hits, int minUniqueDocs, double maxTieRate,
                                        boolean requireTraceability) {
        HealthReport m = measure(hits);
        List<String> failures = new ArrayList<>();
        if (m.uniqueDocs() < minUniqueDocs) {
            failures.add("unique_docs=" + m.uniqueDocs() + " < " + minUniqueDocs);
        }
        if (m.tieRate() > maxTieRate) {
            failures.add(String.format(Locale.ROOT, "tie_rate=%.3f > %s", m.tieRate(), maxTieRate));
        }
        if (requireTraceability) {
            if (m.traceability().missingTitle() > 0) failures.add("missing_title=" + m.traceability().missingTitle());
            if (m.traceability().missingUrl() > 0) failures.add("missing_url=" + m.traceability().missingUrl());
        }
        return new HealthReport(m.totalHits(), m.uniqueDocs(), m.docDiversity(), m.tieRate(), m.duplicationRate(),
                m.traceability(), failures.isEmpty(), List.copyOf(failures));
    }

    static int uniqueDocs(List<RetrievalHit> hits) {
        Set<String> docs = new HashSet<>();
        for (RetrievalHit h : hits) docs.add(h.docId());
        return docs.size();
    }

    /** Shannon entropy (base 2) of the doc id distribution; 0 when one document holds every hit. */
    static double docDiversity(List<RetrievalHit> hits) {
        if (hits.isEmpty()) return 0.0;
        Map<String, Integer> counts = new HashMap<>();
        for (RetrievalHit h : hits) counts.merge(h.docId(), 1, Integer::sum);
        double entropy = 0.0;
        for (int c : counts.values()) {
            double p = (double) c / hits.size();
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /** Fraction of hits whose score is shared with at least one other hit. */
    static double tieRate(List<RetrievalHit> hits) {
        if (hits.size() <= 1) return 0.0;
        Map<Double, Integer> counts = new HashMap<>();
        for (RetrievalHit h : hits) counts.merge(h.fusedScore(), 1, Integer::sum);
        int tied = counts.values().stream().filter(c -> c > 1).mapToInt(Integer::intValue).sum();
        return (double) tied / hits.size();
    }

    static double duplicationRate(List<RetrievalHit> hits) {
        if (hits.isEmpty()) return 0.0;
        Set<String> pairs = new HashSet<>();
        for (RetrievalHit h : hits) pairs.add(h.docId() + "\u0000" + h.chunkId());
        return 1.0 - (double) pairs.size() / hits.size();
    }

    static TraceabilityStats traceability(List<RetrievalHit> hits) {
        int missingTitle = 0;
        int missingUrl = 0;
        int missingSource = 0;
        int complete = 0;
        for (RetrievalHit h : hits) {
            boolean title = notBlank(h.title());
            boolean url = notBlank(h.url());
            if (!title) missingTitle++;
            if (!url) missingUrl++;
            if (!notBlank(h.sourceSystem())) missingSource++;
            if (title && url) complete++;
        }
        return new TraceabilityStats(missingTitle, missingUrl, missingSource, hits.size(), complete);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
