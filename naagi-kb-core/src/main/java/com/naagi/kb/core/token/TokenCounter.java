package com.naagi.kb.core.token;

/**
 * Counts tokens the way the embedding provider will see them.
 */
public interface TokenCounter {

    int count(String text);

    String name();
}
