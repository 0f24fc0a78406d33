package com.naagi.kb.core.token;

/**
 * Approximates token count as one token per four characters.
 * Monotonic in text length, which the truncation search relies on.
 */
public final class HeuristicTokenCounter implements TokenCounter {

    public static final String NAME = "heuristic";

    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    @Override
    public String name() {
        return NAME;
    }
}
