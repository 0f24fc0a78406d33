package com.naagi.kb.chunk;

/**
 * Half-open character range {@code [start, end)} into the normalized text.
 */
record Span(int start, int end) {

    int length() {
        return end - start;
    }

    String of(String text) {
        return text.substring(start, end);
    }
}
