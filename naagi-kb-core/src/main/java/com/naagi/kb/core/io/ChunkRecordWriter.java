package com.naagi.kb.core.io;

import com.naagi.kb.core.model.Chunk;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes chunk records, one JSON object per line, replacing any previous file.
 */
public final class ChunkRecordWriter implements Closeable {

    private final BufferedWriter out;
    private int written;

    public ChunkRecordWriter(Path file) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + file, e);
        }
    }

    public void write(Chunk chunk) {
        try {
            out.write(NdjsonFiles.toLine(chunk));
            out.newLine();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void writeAll(List<Chunk> chunks) {
        chunks.forEach(this::write);
    }

    public int written() {
        return written;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
