package com.naagi.kb.core.io;

import java.nio.file.Path;

/**
 * A structural input of a run (enriched documents, materialized chunks) is absent.
 */
public class MissingArtifactException extends RuntimeException {

    private final Path path;

    public MissingArtifactException(Path path) {
        super("Missing artifact: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
