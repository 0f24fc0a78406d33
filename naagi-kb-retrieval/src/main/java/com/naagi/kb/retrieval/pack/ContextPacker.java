package com.naagi.kb.retrieval.pack;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders ranked passages into a single context string. Each passage is introduced by
 * {@code --- Chunk i (score: s) ---} with its title and URL. When the next passage does not fit,
 * a truncated tail is added only if it is meaningful, and the cut never lands inside a code fence.
 */
public class ContextPacker {

    public static final int DEFAULT_BUDGET = 6000;
    static final String TRUNCATED_MARKER = "\n[... truncated]";

    private static final Pattern CODE_BLOCK = Pattern.compile("```.*?```", Pattern.DOTALL);
    private static final int MIN_USEFUL_CHARS = 50;
    private static final int MIN_TAIL_CHARS = 20;

    /** Passage to pack, already in final rank order. */
    public record Segment(String text, String title, String url, double score) {}

    public PackedContext pack(List<Segment> segments, int maxChars) {
        if (maxChars <= 0) throw new IllegalArgumentException("budget must be positive");
        StringBuilder out = new StringBuilder();
        int included = 0;
        boolean truncated = false;

        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            String text = s.text() == null ? "" : s.text();
            String header = header(i + 1, s);

            if (out.length() + header.length() + text.length() > maxChars) {
                int remaining = out.length() == 0 ? maxChars : maxChars - out.length();
                if (remaining > header.length() + MIN_USEFUL_CHARS) {
                    int limit = Math.min(text.length(), remaining - header.length() - TRUNCATED_MARKER.length());
                    String tail = text.substring(0, safeCut(text, limit));
                    if (tail.strip().length() > MIN_TAIL_CHARS) {
                        out.append(header).append(tail).append(TRUNCATED_MARKER);
                        included++;
                    }
                }
                truncated = true;
                break;
            }
            out.append(header).append(text);
            included++;
        }
        return new PackedContext(maxChars, out.toString(), included, truncated);
    }

    static String header(int position, Segment s) {
        StringBuilder h = new StringBuilder()
                .append("\n\n--- Chunk ").append(position)
                .append(" (score: ").append(String.format(Locale.ROOT, "%.3f", s.score())).append(") ---\n");
        if (s.title() != null && !s.title().isEmpty()) h.append("Title: ").append(s.title()).append('\n');
        if (s.url() != null && !s.url().isEmpty()) h.append("URL: ").append(s.url()).append('\n');
        return h.append('\n').toString();
    }

    /**
     * Largest cut position not above {@code limit} that does not split a fenced code block of {@code text}.
     */
    static int safeCut(String text, int limit) {
        List<int[]> blocks = new ArrayList<>();
        Matcher m = CODE_BLOCK.matcher(text);
        while (m.find()) blocks.add(new int[]{m.start(), m.end()});
        int pos = Math.max(0, limit);
        for (int[] b : blocks) {
            if (b[0] < pos && pos < b[1]) pos = b[0];
        }
        return pos;
    }
}
