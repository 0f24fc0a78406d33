package com.naagi.kb.chunk;

import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.EventSinkFactory;
import com.naagi.kb.core.event.KbEvent;
import com.naagi.kb.core.io.ArtifactFormatException;
import com.naagi.kb.core.io.ChunkRecordWriter;
import com.naagi.kb.core.io.EnrichedDocumentReader;
import com.naagi.kb.core.io.NdjsonFiles;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.core.model.Document;
import com.naagi.kb.core.run.RunLayout;
import com.naagi.kb.core.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Chunks every document of a run's {@code enriched.jsonl} into {@code chunks.ndjson}.
 * A line that is not a valid document, or a document that cannot be chunked, is skipped
 * and recorded; the run continues.
 */
public class ChunkRunner {

    private static final Logger log = LoggerFactory.getLogger(ChunkRunner.class);

    private final RunLayout layout;
    private final TokenCounter tokens;
    private final ChunkingParams params;
    private final EventSinkFactory sinks;

    public ChunkRunner(RunLayout layout, TokenCounter tokens, ChunkingParams params, EventSinkFactory sinks) {
        params.validate();
        this.layout = layout;
        this.tokens = tokens;
        this.params = params;
        this.sinks = sinks;
    }

    /**
     * @throws com.naagi.kb.core.io.MissingArtifactException when the run has no enriched documents
     */
    public ChunkAssuranceReport run(String runId) {
        EventSink events = sinks.forRun(runId);
        HybridChunker chunker = new HybridChunker(tokens, params, events);
        ChunkAssuranceReport.Builder stats = new ChunkAssuranceReport.Builder(runId, tokens.name(), params.hardMaxTokens());
        List<SkippedDocument> skipped = new ArrayList<>();

        log.info("Chunking run {} (tokenizer={}, hardMax={})", runId, tokens.name(), params.hardMaxTokens());
        try (Stream<NdjsonFiles.Line> lines = EnrichedDocumentReader.lines(layout.enrichedFile(runId));
             ChunkRecordWriter writer = new ChunkRecordWriter(layout.chunksFile(runId))) {
            Iterator<NdjsonFiles.Line> it = lines.iterator();
            while (it.hasNext()) {
                NdjsonFiles.Line line = it.next();
                Document doc;
                try {
                    doc = line.as(Document.class);
                } catch (ArtifactFormatException e) {
                    log.warn("Skipping {}", e.getMessage());
                    skip(runId, events, stats, skipped, "line:" + line.number(), "invalid_json");
                    continue;
                }
                try {
                    List<Chunk> chunks = chunker.chunk(runId, doc);
                    if (chunks.isEmpty()) {
                        skip(runId, events, stats, skipped, doc.docId(), "empty_body");
                        continue;
                    }
                    writer.writeAll(chunks);
                    stats.document(chunks);
                } catch (ChunkingException e) {
                    log.warn("Skipping document {}: {}", e.getDocId(), e.getMessage());
                    skip(runId, events, stats, skipped, doc.docId(), e.getReason());
                } catch (UncheckedIOException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Skipping document {} after unexpected error", doc.docId(), e);
                    skip(runId, events, stats, skipped, doc.docId(), "chunk_error");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot finish " + layout.chunksFile(runId), e);
        }

        ChunkAssuranceReport report = stats.build(skipped);
        NdjsonFiles.writeJson(layout.chunkAssuranceFile(runId), report);
        events.emit(KbEvent.of("chunk.run_complete", runId, Map.of(
                "docs_total", report.docsTotal(),
                "chunks_total", report.chunksTotal(),
                "skipped", skipped.size())));
        log.info("Chunked run {}: {} docs -> {} chunks, {} skipped",
                runId, report.docsTotal(), report.chunksTotal(), skipped.size());
        return report;
    }

    private static void skip(String runId, EventSink events, ChunkAssuranceReport.Builder stats,
                             List<SkippedDocument> skipped, String docId, String reason) {
        stats.skipped();
        skipped.add(new SkippedDocument(docId, reason));
        events.emit(KbEvent.of("chunk.doc_skipped", runId, Map.of(
                "doc_id", String.valueOf(docId), "reason", reason)));
    }
}
