package com.naagi.kb.chunk;

import com.naagi.kb.core.io.NdjsonChunkSource;
import com.naagi.kb.core.model.Chunk;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Re-reads a materialized chunk file and checks it against the chunk invariants.
 */
public final class ChunkVerifier {

    public record Result(int chunks, List<String> overCap, List<String> untraceable, List<String> duplicateIds) {

        public boolean ok() {
            return overCap.isEmpty() && untraceable.isEmpty() && duplicateIds.isEmpty();
        }
    }

    private ChunkVerifier() {}

    public static Result verify(Path chunksFile, int hardMaxTokens) {
        List<String> overCap = new ArrayList<>();
        List<String> untraceable = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int n = 0;
        try (Stream<Chunk> chunks = new NdjsonChunkSource(chunksFile).chunks()) {
            Iterator<Chunk> it = chunks.iterator();
            while (it.hasNext()) {
                Chunk c = it.next();
                n++;
                if (c.tokenCount() > hardMaxTokens) overCap.add(c.chunkId());
                if (c.traceability() == null || !c.traceability().isComplete()) untraceable.add(c.chunkId());
                if (!seen.add(c.chunkId())) duplicates.add(c.chunkId());
            }
        }
        return new Result(n, overCap, untraceable, duplicates);
    }
}
