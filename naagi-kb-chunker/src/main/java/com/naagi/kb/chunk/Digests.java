package com.naagi.kb.chunk;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Short stand-ins for content too large to embed verbatim.
 */
final class Digests {

    static final int MAX_SYMBOLS = 5;
    static final int PREVIEW_LINES = 3;
    static final int PREVIEW_LINE_CHARS = 120;

    private static final Pattern SYMBOL = Pattern.compile(
            "\\b(?:def|function|class|interface|enum|func|fn)\\s+([A-Za-z_][A-Za-z0-9_]*)"
                    + "|\\b([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)");

    private Digests() {}

    /**
     * Code digest: fence with language, the top declared symbols and the first few lines.
     */
    static String code(String language, String code) {
        List<String> lines = code.lines().collect(Collectors.toList());
        StringBuilder sb = new StringBuilder();
        sb.append("```").append(language == null ? "" : language).append('\n');
        sb.append("# Code digest").append(language == null || language.isBlank() ? "" : " (" + language + ")").append('\n');
        Set<String> symbols = symbols(code);
        if (!symbols.isEmpty()) {
            sb.append("# Key symbols: ").append(String.join(", ", symbols)).append('\n');
        }
        int shown = Math.min(PREVIEW_LINES, lines.size());
        for (int i = 0; i < shown; i++) {
            String l = lines.get(i);
            sb.append(l.length() > PREVIEW_LINE_CHARS ? l.substring(0, PREVIEW_LINE_CHARS) + "..." : l).append('\n');
        }
        if (lines.size() > shown) {
            sb.append("# ... (").append(lines.size() - shown).append(" more lines)\n");
        } else {
            sb.append("# ... (").append(code.length()).append(" chars)\n");
        }
        sb.append("```");
        return sb.toString();
    }

    static Set<String> symbols(String code) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = SYMBOL.matcher(code);
        while (m.find() && out.size() < MAX_SYMBOLS) {
            out.add(m.group(1) != null ? m.group(1) : m.group(2));
        }
        return out;
    }

    static String fenceLanguage(String fenceLine) {
        String lang = fenceLine.strip().substring(3).strip();
        return lang.isEmpty() ? null : lang;
    }
}
