package com.naagi.kb.core.io;

import com.naagi.kb.core.model.Chunk;

import java.nio.file.Path;
import java.util.stream.Stream;

public final class NdjsonChunkSource implements MaterializedChunkSource {

    private final Path file;

    public NdjsonChunkSource(Path file) {
        this.file = file;
    }

    @Override
    public Stream<Chunk> chunks() {
        return NdjsonFiles.read(file, Chunk.class);
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
