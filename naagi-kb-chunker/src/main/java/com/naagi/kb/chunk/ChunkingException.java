package com.naagi.kb.chunk;

/**
 * A document could not be chunked within the size, coverage or traceability invariants.
 * The document is skipped; the batch continues.
 */
public class ChunkingException extends RuntimeException {

    private final String docId;
    private final String reason;

    public ChunkingException(String docId, String reason, String message) {
        super(message);
        this.docId = docId;
        this.reason = reason;
    }

    public String getDocId() {
        return docId;
    }

    public String getReason() {
        return reason;
    }
}
