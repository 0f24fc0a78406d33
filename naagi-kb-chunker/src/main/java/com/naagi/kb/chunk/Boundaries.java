package com.naagi.kb.chunk;

import com.naagi.kb.core.model.ChunkType;
import com.naagi.kb.core.model.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates split points in normalized text. All results are spans into the text passed in,
 * trimmed of surrounding whitespace.
 */
final class Boundaries {

    private static final Pattern HEADING_LINE = Pattern.compile("^#{1,6}\\s+\\S.*");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?$");
    private static final Pattern FENCED_CODE = Pattern.compile("^```[\\w+-]*\\n[\\s\\S]*?\\n```$");

    private Boundaries() {}

    static Span trim(String text, int start, int end) {
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        return start < end ? new Span(start, end) : null;
    }

    /**
     * Sections from a section map. Returns an empty list when the map is unusable
     * (out of range or not strictly increasing offsets).
     */
    static List<Span> sectionMapSpans(String text, List<Section> sectionMap) {
        List<Integer> starts = new ArrayList<>();
        for (Section s : sectionMap) {
            int start = s.startChar();
            if (start < 0 || start > text.length()) return List.of();
            if (!starts.isEmpty() && start <= starts.get(starts.size() - 1)) return List.of();
            starts.add(start);
        }
        return spansFromStarts(text, starts);
    }

    /**
     * Sections introduced by markdown heading lines. Heading-like lines inside code fences are ignored.
     */
    static List<Span> headingSpans(String text) {
        List<Integer> starts = new ArrayList<>();
        boolean inFence = false;
        int i = 0;
        while (i < text.length()) {
            int lineEnd = lineEnd(text, i, text.length());
            String line = text.substring(i, lineEnd);
            if (isFence(line)) {
                inFence = !inFence;
            } else if (!inFence && HEADING_LINE.matcher(line).matches()) {
                starts.add(i);
            }
            i = lineEnd + 1;
        }
        return spansFromStarts(text, starts);
    }

    private static List<Span> spansFromStarts(String text, List<Integer> starts) {
        List<Span> out = new ArrayList<>();
        if (starts.isEmpty()) return out;
        List<Integer> cuts = new ArrayList<>();
        if (starts.get(0) > 0) cuts.add(0);
        cuts.addAll(starts);
        for (int k = 0; k < cuts.size(); k++) {
            int end = k + 1 < cuts.size() ? cuts.get(k + 1) : text.length();
            Span s = trim(text, cuts.get(k), end);
            if (s != null) out.add(s);
        }
        return out;
    }

    /**
     * Splits {@code [start, end)} into code blocks, table row runs and paragraphs.
     * Code fences are matched first so blank lines inside code never split a block.
     */
    static List<Block> blocks(String text, int start, int end) {
        List<Block> out = new ArrayList<>();
        int i = start;
        while (i < end) {
            int le = lineEnd(text, i, end);
            String line = text.substring(i, le);
            if (line.isBlank()) {
                i = le + 1;
                continue;
            }
            if (isFence(line)) {
                int blockEnd = end;
                int j = le + 1;
                while (j < end) {
                    int le2 = lineEnd(text, j, end);
                    if (isFence(text.substring(j, le2))) {
                        blockEnd = le2;
                        break;
                    }
                    j = le2 + 1;
                }
                addBlock(out, text, i, blockEnd, Block.Kind.CODE);
                i = blockEnd + 1;
                continue;
            }
            boolean table = isTableLine(line);
            int blockStart = i;
            int blockEnd = le;
            int j = le + 1;
            while (j < end) {
                int le2 = lineEnd(text, j, end);
                String next = text.substring(j, le2);
                if (next.isBlank() || isFence(next) || isTableLine(next) != table) break;
                blockEnd = le2;
                j = le2 + 1;
            }
            addBlock(out, text, blockStart, blockEnd, table ? Block.Kind.TABLE : Block.Kind.PARAGRAPH);
            i = j;
        }
        return out;
    }

    private static void addBlock(List<Block> out, String text, int start, int end, Block.Kind kind) {
        Span s = trim(text, start, end);
        if (s != null) out.add(new Block(s.start(), s.end(), kind));
    }

    static List<Span> sentences(String text, Span within) {
        List<Span> out = new ArrayList<>();
        Matcher m = SENTENCE_END.matcher(text).region(within.start(), within.end());
        int from = within.start();
        while (m.find()) {
            Span s = trim(text, from, m.start());
            if (s != null) out.add(s);
            from = m.end();
        }
        Span last = trim(text, from, within.end());
        if (last != null) out.add(last);
        return out;
    }

    static List<Span> words(String text, Span within) {
        List<Span> out = new ArrayList<>();
        Matcher m = WORD.matcher(text).region(within.start(), within.end());
        while (m.find()) {
            out.add(new Span(m.start(), m.end()));
        }
        return out;
    }

    /** Non-blank lines, keeping leading indentation. */
    static List<Span> lines(String text, int start, int end) {
        List<Span> out = new ArrayList<>();
        int i = start;
        while (i < end) {
            int le = lineEnd(text, i, end);
            int e = le;
            while (e > i && Character.isWhitespace(text.charAt(e - 1))) e--;
            if (e > i && !text.substring(i, e).isBlank()) out.add(new Span(i, e));
            i = le + 1;
        }
        return out;
    }

    static int lineEnd(String text, int from, int limit) {
        int nl = text.indexOf('\n', from);
        return nl < 0 || nl > limit ? limit : nl;
    }

    static boolean isFence(String line) {
        return line.stripLeading().startsWith("```");
    }

    static boolean isTableLine(String line) {
        String t = line.strip();
        if (t.isEmpty()) return false;
        int pipes = 0;
        for (int k = 0; k < t.length(); k++) {
            if (t.charAt(k) == '|') pipes++;
        }
        return pipes >= 2;
    }

    static boolean isTableSeparator(String line) {
        return TABLE_SEPARATOR.matcher(line.strip()).matches();
    }

    static boolean isHeadingLine(String line) {
        return HEADING_LINE.matcher(line.strip()).matches();
    }

    /**
     * Classifies a span of text by its dominant structure.
     */
    static ChunkType detectType(String text) {
        String t = text.strip();
        if (FENCED_CODE.matcher(t).matches()) return ChunkType.CODE;
        List<Span> ls = lines(t, 0, t.length());
        if (!ls.isEmpty() && ls.stream().allMatch(s -> isTableLine(s.of(t)))) return ChunkType.TABLE;
        if (!ls.isEmpty() && isHeadingLine(ls.get(0).of(t))) return ChunkType.HEADING;
        return ChunkType.PARAGRAPH;
    }
}
