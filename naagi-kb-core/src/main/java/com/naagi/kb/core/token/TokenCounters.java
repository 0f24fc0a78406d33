package com.naagi.kb.core.token;

import java.util.Locale;

public final class TokenCounters {

    private TokenCounters() {}

    /**
     * Resolves a tokenizer by name ({@code cl100k} or {@code heuristic}).
     *
     * @throws TokenizerUnavailableException when the name is unknown or the encoding cannot be loaded
     */
    public static TokenCounter create(String name) {
        String key = name == null ? Cl100kTokenCounter.NAME : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case Cl100kTokenCounter.NAME, "cl100k_base", "tiktoken" -> loadCl100k();
            case HeuristicTokenCounter.NAME -> new HeuristicTokenCounter();
            default -> throw new TokenizerUnavailableException("Unknown tokenizer: " + name);
        };
    }

    public static boolean isAvailable(String name) {
        try {
            create(name);
            return true;
        } catch (TokenizerUnavailableException e) {
            return false;
        }
    }

    private static TokenCounter loadCl100k() {
        try {
            return new Cl100kTokenCounter();
        } catch (RuntimeException | LinkageError e) {
            throw new TokenizerUnavailableException("cl100k encoding could not be loaded", e);
        }
    }
}
