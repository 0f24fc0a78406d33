package com.naagi.kb.embed.store;

import java.time.Instant;

/**
 * One vector for one chunk under one provider. Unique on {@code (chunkId, provider)}.
 */
public record EmbeddingRecord(
        String chunkId,
        String provider,
        String model,
        int dimension,
        float[] vector,
        String contentSha256,
        Instant createdAt
) {}
