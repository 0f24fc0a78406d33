package com.naagi.kb.chunk;

import com.naagi.kb.core.model.ChunkType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Intermediate chunk before ordinals are assigned.
 *
 * @param verbatim true when {@code text} is exactly the covered substring of the normalized text;
 *                 false for pieces carrying repeated table headers, code fences or digests
 */
record Piece(
        int start,
        int end,
        String text,
        int tokens,
        ChunkType type,
        String strategy,
        Map<String, Object> meta,
        boolean verbatim
) {

    static Piece verbatim(String body, int start, int end, int tokens, ChunkType type, String strategy) {
        return new Piece(start, end, body.substring(start, end), tokens, type, strategy, new LinkedHashMap<>(), true);
    }

    static Piece synthetic(int start, int end, String text, int tokens, ChunkType type, String strategy) {
        return new Piece(start, end, text, tokens, type, strategy, new LinkedHashMap<>(), false);
    }

    Piece withMeta(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(meta);
        m.put(key, value);
        return new Piece(start, end, text, tokens, type, strategy, m, verbatim);
    }

    Span span() {
        return new Span(start, end);
    }
}
