package com.naagi.kb.embed.store;

import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.core.model.Traceability;
import com.naagi.kb.core.util.Hashing;

/**
 * Chunk row as kept by the store, with the traceability fields flattened for retrieval.
 */
public record StoredChunk(
        String chunkId,
        String docId,
        int ordinal,
        String text,
        int tokenCount,
        String chunkType,
        String title,
        String url,
        String sourceSystem,
        String spaceKey,
        String doctype,
        String contentSha256
) {

    public static StoredChunk from(Chunk c) {
        Traceability t = c.traceability();
        Object doctype = c.meta().get("doctype");
        return new StoredChunk(c.chunkId(), c.docId(), c.ordinal(), c.text(), c.tokenCount(),
                c.chunkType() == null ? null : c.chunkType().label(),
                t == null ? null : t.title(),
                t == null ? null : t.url(),
                t == null ? null : t.sourceSystem(),
                t == null ? null : t.spaceKey(),
                doctype == null ? null : doctype.toString(),
                Hashing.sha256Hex(c.text()));
    }
}
