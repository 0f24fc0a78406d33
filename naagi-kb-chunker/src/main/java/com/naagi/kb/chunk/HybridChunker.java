package com.naagi.kb.chunk;

import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.KbEvent;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.core.model.Document;
import com.naagi.kb.core.model.Traceability;
import com.naagi.kb.core.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits one normalized document into ordered chunks that never exceed {@code hardMaxTokens},
 * keep semantic boundaries where they can, and cover the document text.
 */
public class HybridChunker {

    private static final Logger log = LoggerFactory.getLogger(HybridChunker.class);

    private static final int MAX_REPORTED_GAPS = 5;

    private final TokenCounter tokens;
    private final ChunkingParams params;
    private final EventSink events;
    private final LayeredSplitter splitter;
    private final GluePass glue;

    public HybridChunker(TokenCounter tokens, ChunkingParams params, EventSink events) {
        params.validate();
        this.tokens = tokens;
        this.params = params;
        this.events = events;
        this.splitter = new LayeredSplitter(tokens, params);
        this.glue = new GluePass(tokens, params);
    }

    /**
     * @return the chunks, or an empty list for a document without body text
     * @throws ChunkingException when the document cannot be chunked within invariants
     */
    public List<Chunk> chunk(String runId, Document doc) {
        String body = normalize(doc.bodyText());
        if (body.isEmpty()) return List.of();

        Traceability trace = Traceability.of(doc);
        if (!trace.isComplete()) {
            throw new ChunkingException(doc.docId(), "missing_traceability",
                    "Document " + doc.docId() + " has no source_system or neither title nor url");
        }

        events.emit(KbEvent.of("chunk.doc_start", runId, Map.of("doc_id", doc.docId(), "chars", body.length())));

        // Section offsets refer to the enriched text; only trust them if normalization left it unchanged.
        boolean offsetsValid = body.equals(doc.bodyText());
        List<Piece> pieces = splitter.split(body, offsetsValid ? doc.sectionMap() : List.of());
        pieces = enforceHardCap(body, pieces);
        pieces = glue.apply(body, pieces);

        Coverage coverage = Coverage.of(body, pieces);
        if (coverage.ratio() < params.minCoverage()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("doc_id", doc.docId());
            f.put("coverage", coverage.ratio());
            f.put("gaps", coverage.gaps().subList(0, Math.min(MAX_REPORTED_GAPS, coverage.gaps().size())));
            events.emit(KbEvent.of("chunk.coverage_warning", runId, f));
            throw new ChunkingException(doc.docId(), "coverage_below_threshold",
                    String.format("Coverage %.4f below %.4f for %s", coverage.ratio(), params.minCoverage(), doc.docId()));
        }

        List<Chunk> out = new ArrayList<>(pieces.size());
        for (int ord = 0; ord < pieces.size(); ord++) {
            Piece p = pieces.get(ord);
            if (p.tokens() > params.hardMaxTokens()) {
                throw new ChunkingException(doc.docId(), "hard_cap_exceeded",
                        "Chunk " + ord + " of " + doc.docId() + " has " + p.tokens() + " tokens");
            }
            Map<String, Object> meta = new LinkedHashMap<>(p.meta());
            if (doc.doctype() != null) meta.put("doctype", doc.doctype());
            Chunk chunk = new Chunk(Chunk.chunkId(doc.docId(), ord), doc.docId(), ord, p.text(), p.tokens(),
                    p.start(), p.end(), p.type(), p.strategy(), trace, meta);
            out.add(chunk);
            emitChunkEvents(runId, chunk);
        }

        log.debug("Chunked {} into {} chunks (coverage={})", doc.docId(), out.size(), coverage.ratio());
        return out;
    }

    private List<Piece> enforceHardCap(String body, List<Piece> pieces) {
        List<Piece> out = new ArrayList<>(pieces.size());
        for (Piece p : pieces) {
            if (p.tokens() <= params.hardMaxTokens()) {
                out.add(p);
            } else {
                out.add(splitter.forceTruncate(body, p.span(), p.type()));
            }
        }
        return out;
    }

    private void emitChunkEvents(String runId, Chunk chunk) {
        events.emit(KbEvent.of("chunk.emit", runId, Map.of(
                "chunk_id", chunk.chunkId(),
                "token_count", chunk.tokenCount(),
                "chunk_type", chunk.chunkType().label(),
                "split_strategy", chunk.splitStrategy())));
        if (chunk.meta().containsKey("digest")) {
            events.emit(KbEvent.of("chunk.digest", runId, Map.of(
                    "chunk_id", chunk.chunkId(), "raw_chars", chunk.meta().get("raw_chars"))));
        }
        if (Boolean.TRUE.equals(chunk.meta().get("force_truncate"))) {
            log.warn("Force-truncated chunk {} ({} raw chars)", chunk.chunkId(), chunk.meta().get("raw_chars"));
            events.emit(KbEvent.of("chunk.force_truncate", runId, Map.of(
                    "chunk_id", chunk.chunkId(), "token_count", chunk.tokenCount())));
        }
    }

    public ChunkingParams params() {
        return params;
    }

    public TokenCounter tokenCounter() {
        return tokens;
    }

    static String normalize(String s) {
        if (s == null) return "";
        return s.replace("\u0000", " ")
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                .replaceAll("\\n{3,}", "\n\n")
                .strip();
    }
}
