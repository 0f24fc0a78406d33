package com.naagi.kb.chunk;

/**
 * Structural unit inside a section: a fenced code block, a run of table rows or a paragraph.
 */
record Block(int start, int end, Kind kind) {

    enum Kind { PARAGRAPH, CODE, TABLE }

    Span span() {
        return new Span(start, end);
    }
}
