package com.naagi.kb.core.event;

import com.naagi.kb.core.io.NdjsonFiles;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends events as JSON lines to a file. Each call opens, appends and closes,
 * so several components may share one log.
 */
public class NdjsonEventSink implements EventSink {

    private final Path file;

    public NdjsonEventSink(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void emit(KbEvent event) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            Files.writeString(file, NdjsonFiles.toLine(event) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append event to " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
