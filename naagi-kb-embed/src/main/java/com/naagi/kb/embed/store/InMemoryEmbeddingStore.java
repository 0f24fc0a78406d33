package com.naagi.kb.embed.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store used by tests and the {@code memory} store type.
 */
public class InMemoryEmbeddingStore implements EmbeddingStore {

    private record Key(String chunkId, String provider) {}

    private final int dimension;
    private final Map<String, StoredChunk> chunks = new ConcurrentHashMap<>();
    private final Map<Key, EmbeddingRecord> embeddings = new ConcurrentHashMap<>();

    public InMemoryEmbeddingStore(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public int expectedDimension() {
        return dimension;
    }

    @Override
    public Map<String, String> existingContentHashes(String provider, Collection<String> chunkIds) {
        Map<String, String> out = new HashMap<>();
        for (String id : chunkIds) {
            EmbeddingRecord r = embeddings.get(new Key(id, provider));
            if (r != null) out.put(id, r.contentSha256());
        }
        return out;
    }

    @Override
    public void upsertChunks(List<StoredChunk> batch) {
        for (StoredChunk c : batch) chunks.put(c.chunkId(), c);
    }

    @Override
    public int upsertEmbeddings(List<EmbeddingRecord> records) {
        int inserted = 0;
        for (EmbeddingRecord r : records) {
            if (r.vector().length != dimension) {
                throw new IllegalArgumentException("Vector for " + r.chunkId() + " has dimension "
                        + r.vector().length + ", store expects " + dimension);
            }
            if (embeddings.put(new Key(r.chunkId(), r.provider()), r) == null) inserted++;
        }
        return inserted;
    }

    @Override
    public long countEmbeddings(String provider) {
        return embeddings.keySet().stream().filter(k -> k.provider().equals(provider)).count();
    }

    public List<EmbeddingRecord> embeddings(String provider) {
        List<EmbeddingRecord> out = new ArrayList<>();
        embeddings.forEach((k, v) -> {
            if (k.provider().equals(provider)) out.add(v);
        });
        return out;
    }

    public StoredChunk chunk(String chunkId) {
        return chunks.get(chunkId);
    }

    public Collection<StoredChunk> chunks() {
        return List.copyOf(chunks.values());
    }
}
