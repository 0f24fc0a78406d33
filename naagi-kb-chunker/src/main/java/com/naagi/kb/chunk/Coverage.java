package com.naagi.kb.chunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Share of the normalized text covered by chunk spans. Whitespace-only gaps between spans
 * count as covered.
 */
public record Coverage(double ratio, int coveredChars, int totalChars, List<Gap> gaps) {

    public record Gap(int start, int end) {}

    static Coverage of(String body, List<Piece> pieces) {
        int total = body.length();
        if (total == 0) return new Coverage(1.0, 0, 0, List.of());

        List<Span> spans = new ArrayList<>();
        for (Piece p : pieces) spans.add(p.span());
        spans.sort(Comparator.comparingInt(Span::start));

        List<Gap> gaps = new ArrayList<>();
        int uncovered = 0;
        int cursor = 0;
        for (Span s : spans) {
            if (s.start() > cursor) {
                uncovered += gap(body, cursor, s.start(), gaps);
            }
            cursor = Math.max(cursor, s.end());
        }
        if (cursor < total) {
            uncovered += gap(body, cursor, total, gaps);
        }
        int covered = total - uncovered;
        return new Coverage((double) covered / total, covered, total, gaps);
    }

    private static int gap(String body, int start, int end, List<Gap> gaps) {
        if (body.substring(start, end).isBlank()) return 0;
        gaps.add(new Gap(start, end));
        return end - start;
    }
}
