package com.naagi.kb.embed.preflight;

/**
 * Structural reasons a run is BLOCKED. Quality signals are never a reason.
 */
public enum PreflightReason {
    MISSING_ENRICH,
    MISSING_CHUNKS,
    TOKENIZER_MISSING,
    CONFIG_INVALID,
    EMBEDDABLE_DOCS_ZERO
}
