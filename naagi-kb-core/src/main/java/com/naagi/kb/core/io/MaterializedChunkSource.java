package com.naagi.kb.core.io;

import com.naagi.kb.core.model.Chunk;

import java.util.stream.Stream;

/**
 * Read-only view over the chunks a run has already materialized.
 * <p>
 * Ingestion consumes chunks only through this type and never re-chunks.
 * Callers must close the returned stream.
 */
public interface MaterializedChunkSource {

    Stream<Chunk> chunks();

    String describe();
}
