package com.naagi.kb.core.io;

import com.naagi.kb.core.model.Document;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the normalized documents a run's enrichment step produced ({@code enriched.jsonl}).
 */
public final class EnrichedDocumentReader {

    private EnrichedDocumentReader() {}

    public static Stream<Document> stream(Path file) {
        return NdjsonFiles.read(file, Document.class);
    }

    public static Stream<NdjsonFiles.Line> lines(Path file) {
        return NdjsonFiles.lines(file);
    }

    public static List<Document> readAll(Path file) {
        try (Stream<Document> docs = stream(file)) {
            return docs.collect(Collectors.toList());
        }
    }
}
