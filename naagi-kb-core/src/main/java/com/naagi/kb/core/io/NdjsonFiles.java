package com.naagi.kb.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.naagi.kb.core.json.Json;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Newline-delimited JSON helpers: one object per line, blank lines ignored.
 */
public final class NdjsonFiles {

    private NdjsonFiles() {}

    public static <T> Stream<T> read(Path file, Class<T> type) {
        return lines(file).map(line -> line.as(type));
    }

    /**
     * Non-blank lines with their 1-based line numbers, left unparsed so callers can
     * decide per line what a malformed record means.
     */
    public static Stream<Line> lines(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MissingArtifactException(file);
        }
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + file, e);
        }
        AtomicInteger lineNo = new AtomicInteger();
        return reader.lines()
                .map(l -> new Line(file, lineNo.incrementAndGet(), l))
                .filter(l -> !l.text().isBlank())
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    public static String toLine(Object value) {
        try {
            return Json.MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static void writeJson(Path file, Object value) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            Json.MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    public static <T> T readJson(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            throw new MissingArtifactException(file);
        }
        try {
            return Json.MAPPER.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new ArtifactFormatException("Cannot parse " + file, e);
        }
    }

    public record Line(Path file, int number, String text) {

        /**
         * @throws ArtifactFormatException when the line is not a valid {@code type}
         */
        public <T> T as(Class<T> type) {
            try {
                return Json.MAPPER.readValue(text, type);
            } catch (JsonProcessingException e) {
                throw new ArtifactFormatException(file + ":" + number + " is not a valid " + type.getSimpleName(), e);
            }
        }
    }
}
