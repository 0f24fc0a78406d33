package com.naagi.kb.retrieval.search;

import com.naagi.kb.embed.store.EmbeddingRecord;
import com.naagi.kb.embed.store.InMemoryEmbeddingStore;
import com.naagi.kb.embed.store.StoredChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force cosine scan over an {@link InMemoryEmbeddingStore}.
 */
public class InMemoryDenseRetriever implements DenseRetriever {

    static final Comparator<Candidate> ORDER = Comparator.comparingDouble(Candidate::score).reversed()
            .thenComparing(Candidate::docId)
            .thenComparing(Candidate::chunkId);

    private final InMemoryEmbeddingStore store;

    public InMemoryDenseRetriever(InMemoryEmbeddingStore store) {
        this.store = store;
    }

    @Override
    public List<Candidate> search(String provider, float[] queryVector, int topK, CandidateFilter filter) {
        List<Candidate> scored = new ArrayList<>();
        for (EmbeddingRecord r : store.embeddings(provider)) {
            StoredChunk c = store.chunk(r.chunkId());
            if (c == null || !filter.accepts(c.spaceKey(), c.title(), c.doctype())) continue;
            scored.add(toCandidate(c, cosine(queryVector, r.vector())));
        }
        scored.sort(ORDER);
        return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : scored;
    }

    static Candidate toCandidate(StoredChunk c, double score) {
        return new Candidate(c.chunkId(), c.docId(), c.text(), c.title(), c.url(), c.sourceSystem(),
                c.spaceKey(), c.doctype(), score);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb) + 1e-8);
    }
}
