package com.naagi.kb.embed.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Vector store keyed on {@code (chunk_id, provider)}. Writes are upserts, so concurrent
 * writers and resumed runs never create duplicates.
 */
public interface EmbeddingStore {

    /** Fixed vector dimension of the store. */
    int expectedDimension();

    /**
     * Content hashes of the chunks among {@code chunkIds} that already have an embedding for {@code provider}.
     */
    Map<String, String> existingContentHashes(String provider, Collection<String> chunkIds);

    void upsertChunks(List<StoredChunk> chunks);

    /**
     * @return the number of rows that did not exist before
     */
    int upsertEmbeddings(List<EmbeddingRecord> records);

    long countEmbeddings(String provider);
}
