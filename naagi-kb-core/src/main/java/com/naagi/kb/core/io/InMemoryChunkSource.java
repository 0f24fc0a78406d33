package com.naagi.kb.core.io;

import com.naagi.kb.core.model.Chunk;

import java.util.List;
import java.util.stream.Stream;

public final class InMemoryChunkSource implements MaterializedChunkSource {

    private final List<Chunk> chunks;

    public InMemoryChunkSource(List<Chunk> chunks) {
        this.chunks = List.copyOf(chunks);
    }

    @Override
    public Stream<Chunk> chunks() {
        return chunks.stream();
    }

    @Override
    public String describe() {
        return "memory(" + chunks.size() + " chunks)";
    }
}
