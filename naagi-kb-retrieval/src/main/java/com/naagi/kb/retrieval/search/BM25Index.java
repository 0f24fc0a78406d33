package com.naagi.kb.retrieval.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory BM25 index over chunk text.
 * Writes are synchronized; searches read a consistent snapshot of the postings they touch.
 */
public class BM25Index {

    private static final Logger log = LoggerFactory.getLogger(BM25Index.class);

    // Term frequency saturation and length normalization
    private static final double K1 = 1.5;
    private static final double B = 0.75;

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all",
            "can", "had", "her", "was", "one", "our", "out", "has",
            "have", "been", "were", "they", "this", "that", "with",
            "from", "will", "would", "there", "their", "what", "about",
            "which", "when", "make", "like", "just", "know", "take",
            "into", "your", "some", "could", "them", "than", "then",
            "now", "only", "its", "over", "also", "after", "how",
            "any", "these", "most", "being"
    );

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> postings = new ConcurrentHashMap<>();
    private volatile double avgLength = 0;
    private long totalLength = 0;

    private record Entry(String chunkId, String docId, Map<String, Integer> termFrequencies, int length) {}

    public record Scored(String chunkId, String docId, double score) {}

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT)
                        .replaceAll("[^a-z0-9\\s]", " ")
                        .split("\\s+"))
                .filter(t -> t.length() > 2)
                .filter(t -> !STOPWORDS.contains(t))
                .collect(Collectors.toList());
    }

    public synchronized void index(String chunkId, String docId, String text) {
        if (entries.containsKey(chunkId)) {
            remove(chunkId);
        }
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return;
        }
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        entries.put(chunkId, new Entry(chunkId, docId, tf, tokens.size()));
        tf.forEach((term, count) -> postings.computeIfAbsent(term, k -> new ConcurrentHashMap<>()).put(chunkId, count));
        totalLength += tokens.size();
        avgLength = (double) totalLength / entries.size();
        log.debug("Indexed chunk {} with {} terms", chunkId, tokens.size());
    }

    public synchronized void remove(String chunkId) {
        Entry e = entries.remove(chunkId);
        if (e == null) {
            return;
        }
        for (String term : e.termFrequencies().keySet()) {
            Map<String, Integer> p = postings.get(term);
            if (p != null) {
                p.remove(chunkId);
                if (p.isEmpty()) postings.remove(term);
            }
        }
        totalLength -= e.length();
        avgLength = entries.isEmpty() ? 0 : (double) totalLength / entries.size();
    }

    public int size() {
        return entries.size();
    }

    /**
     * score(D,Q) = sum over query terms of IDF(q) * tf * (k1 + 1) / (tf + k1 * (1 - b + b * |D| / avgdl)),
     * with IDF(q) = ln((N - df + 0.5) / (df + 0.5) + 1). Ties are ordered by doc id, then chunk id.
     */
    public List<Scored> search(String query, int topK, Predicate<String> accept) {
        List<String> terms = tokenize(query).stream().distinct().toList();
        int n = entries.size();
        if (terms.isEmpty() || n == 0 || topK <= 0) {
            return List.of();
        }

        Map<String, Double> scores = new HashMap<>();
        for (String term : terms) {
            Map<String, Integer> p = postings.get(term);
            if (p == null || p.isEmpty()) continue;

            int df = p.size();
            double idf = Math.log((n - df + 0.5) / (df + 0.5) + 1);
            for (Map.Entry<String, Integer> posting : p.entrySet()) {
                Entry e = entries.get(posting.getKey());
                if (e == null || !accept.test(e.chunkId())) continue;
                int tf = posting.getValue();
                double norm = 1 - B + B * (e.length() / avgLength);
                scores.merge(e.chunkId(), idf * (tf * (K1 + 1)) / (tf + K1 * norm), Double::sum);
            }
        }

        List<Scored> out = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> {
            Entry e = entries.get(id);
            if (e != null) out.add(new Scored(id, e.docId(), score));
        });
        out.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(Scored::docId)
                .thenComparing(Scored::chunkId));
        return out.size() > topK ? List.copyOf(out.subList(0, topK)) : out;
    }
}
