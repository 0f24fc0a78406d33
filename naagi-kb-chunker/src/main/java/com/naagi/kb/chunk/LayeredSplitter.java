package com.naagi.kb.chunk;

import com.naagi.kb.core.model.ChunkType;
import com.naagi.kb.core.model.Section;
import com.naagi.kb.core.token.TokenCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntBinaryOperator;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;

/**
 * Splits normalized text into pieces no larger than {@code hardMaxTokens}, descending through
 * headings, blocks (paragraph / code / table), sentences, words and finally truncation.
 * A level is only entered for content that does not fit at the level above.
 */
final class LayeredSplitter {

    static final String TRUNCATION_MARKER = "\n[TRUNCATED]";

    static final String NO_SPLIT = "no-split";
    static final String SECTION_MAP = "section-map";
    static final String HEADING = "heading";
    static final String PARAGRAPH = "paragraph";
    static final String SENTENCE = "sentence";
    static final String CODE_FENCE = "code-fence";
    static final String CODE_DIGEST = "code-digest";
    static final String TABLE_ROWS = "table-rows";
    static final String TOKEN_WINDOW = "token-window";
    static final String FORCE_TRUNCATE = "force-truncate";

    @FunctionalInterface
    private interface GroupBuilder {
        Piece build(int from, int to);
    }

    private final TokenCounter tokens;
    private final ChunkingParams params;
    private final int hardMax;

    LayeredSplitter(TokenCounter tokens, ChunkingParams params) {
        this.tokens = tokens;
        this.params = params;
        this.hardMax = params.hardMaxTokens();
    }

    List<Piece> split(String body, List<Section> sectionMap) {
        Span all = Boundaries.trim(body, 0, body.length());
        if (all == null) return List.of();

        String text = all.of(body);
        int total = tokens.count(text);
        if (total <= hardMax) {
            return List.of(Piece.verbatim(body, all.start(), all.end(), total, Boundaries.detectType(text), NO_SPLIT));
        }

        List<Span> sections = List.of();
        String strategy = HEADING;
        if (params.preferHeadings() && sectionMap != null && !sectionMap.isEmpty()) {
            sections = Boundaries.sectionMapSpans(body, sectionMap);
            strategy = SECTION_MAP;
        }
        if (sections.size() <= 1) {
            sections = Boundaries.headingSpans(body);
            strategy = HEADING;
        }
        if (sections.size() <= 1) {
            return splitBlocks(body, all);
        }

        List<Piece> out = new ArrayList<>();
        for (Span s : sections) {
            String st = s.of(body);
            int t = tokens.count(st);
            if (t <= hardMax) {
                out.add(Piece.verbatim(body, s.start(), s.end(), t, Boundaries.detectType(st), strategy));
            } else {
                out.addAll(splitBlocks(body, s));
            }
        }
        return out;
    }

    private List<Piece> splitBlocks(String body, Span span) {
        List<Block> blocks = Boundaries.blocks(body, span.start(), span.end());
        if (blocks.isEmpty()) return List.of();
        List<Span> units = new ArrayList<>(blocks.size());
        for (Block b : blocks) units.add(b.span());

        return packRuns(units, hardMax, measure(body, units),
                k -> blocks.get(k).kind() == Block.Kind.PARAGRAPH,
                (f, t) -> verbatim(body, units, f, t, typeOf(body, blocks, f, t), PARAGRAPH),
                k -> splitOversizedBlock(body, blocks.get(k)));
    }

    private List<Piece> splitOversizedBlock(String body, Block block) {
        return switch (block.kind()) {
            case CODE -> splitCode(body, block);
            case TABLE -> splitTable(body, block);
            case PARAGRAPH -> splitSentences(body, block.span());
        };
    }

    private List<Piece> splitSentences(String body, Span span) {
        List<Span> sentences = Boundaries.sentences(body, span);
        if (sentences.size() <= 1) {
            return splitWords(body, span);
        }
        return packRuns(sentences, hardMax, measure(body, sentences), k -> true,
                (f, t) -> verbatim(body, sentences, f, t, ChunkType.SENTENCE, SENTENCE),
                k -> splitWords(body, sentences.get(k)));
    }

    private List<Piece> splitWords(String body, Span span) {
        List<Span> words = Boundaries.words(body, span);
        if (words.isEmpty()) return List.of();
        return packRuns(words, hardMax, measure(body, words), k -> true,
                (f, t) -> verbatim(body, words, f, t, ChunkType.TOKEN_WINDOW, TOKEN_WINDOW),
                k -> List.of(forceTruncate(body, words.get(k), ChunkType.TOKEN_WINDOW)));
    }

    private List<Piece> splitCode(String body, Block block) {
        List<Span> lines = Boundaries.lines(body, block.start(), block.end());
        String language = Digests.fenceLanguage(lines.get(0).of(body));
        boolean closed = lines.size() > 1 && Boundaries.isFence(lines.get(lines.size() - 1).of(body));
        List<Span> interior = lines.subList(1, closed ? lines.size() - 1 : lines.size());

        String open = "```" + (language == null ? "" : language);
        String close = "```";
        int budget = hardMax - tokens.count(open + "\n\n" + close) - 1;
        if (interior.isEmpty() || budget <= 0) {
            return List.of(forceTruncate(body, block.span(), ChunkType.CODE));
        }

        int last = interior.size() - 1;
        return packRuns(interior, budget, measure(body, interior), k -> true,
                (f, t) -> {
                    int start = f == 0 ? block.start() : interior.get(f).start();
                    int end = t == last ? block.end() : interior.get(t).end();
                    String text = open + "\n" + body.substring(interior.get(f).start(), interior.get(t).end()) + "\n" + close;
                    return Piece.synthetic(start, end, text, tokens.count(text), ChunkType.CODE, CODE_FENCE);
                },
                k -> {
                    Span line = interior.get(k);
                    int start = k == 0 ? block.start() : line.start();
                    int end = k == last ? block.end() : line.end();
                    return List.of(codeDigest(language, line.of(body), start, end));
                });
    }

    private Piece codeDigest(String language, String code, int start, int end) {
        String text = Digests.code(language, code);
        boolean truncated = false;
        if (tokens.count(text) > hardMax) {
            text = truncateToFit(text);
            truncated = true;
        }
        Piece p = Piece.synthetic(start, end, text, tokens.count(text), ChunkType.CODE, CODE_DIGEST)
                .withMeta("digest", "code")
                .withMeta("raw_chars", code.length());
        if (language != null) p = p.withMeta("language", language);
        return truncated ? p.withMeta("force_truncate", true) : p;
    }

    private List<Piece> splitTable(String body, Block block) {
        List<Span> lines = Boundaries.lines(body, block.start(), block.end());
        StringBuilder prefix = new StringBuilder(lines.get(0).of(body).strip()).append('\n');
        int rowsFrom = 1;
        if (lines.size() > 1 && Boundaries.isTableSeparator(lines.get(1).of(body))) {
            prefix.append(lines.get(1).of(body).strip()).append('\n');
            rowsFrom = 2;
        }
        List<Span> rows = lines.subList(rowsFrom, lines.size());
        String header = prefix.toString();
        int budget = hardMax - tokens.count(header) - 1;
        if (rows.isEmpty() || budget <= 0) {
            return splitWords(body, block.span());
        }

        int last = rows.size() - 1;
        return packRuns(rows, budget, measure(body, rows), k -> true,
                (f, t) -> {
                    int start = f == 0 ? block.start() : rows.get(f).start();
                    int end = t == last ? block.end() : rows.get(t).end();
                    String text = header + body.substring(rows.get(f).start(), rows.get(t).end());
                    return Piece.synthetic(start, end, text, tokens.count(text), ChunkType.TABLE, TABLE_ROWS)
                            .withMeta("table_rows", t - f + 1);
                },
                k -> {
                    List<Piece> windows = new ArrayList<>();
                    for (Piece p : splitWords(body, rows.get(k))) {
                        windows.add(p.withMeta("oversized_table_row", true));
                    }
                    return windows;
                });
    }

    /**
     * Greedily packs consecutive units into groups within {@code budget}. Units that do not fit
     * on their own are handed to {@code oversized}. When a run of fitting units splits, the next
     * group starts with trailing units of the previous group worth at most {@code overlapTokens}.
     */
    private List<Piece> packRuns(List<Span> units, int budget, IntBinaryOperator measure, IntPredicate canOverlap,
                                 GroupBuilder builder, IntFunction<List<Piece>> oversized) {
        List<Piece> out = new ArrayList<>();
        int n = units.size();
        int i = 0;
        while (i < n) {
            if (measure.applyAsInt(i, i) > budget) {
                out.addAll(oversized.apply(i));
                i++;
                continue;
            }
            int runEnd = i;
            while (runEnd + 1 < n && measure.applyAsInt(runEnd + 1, runEnd + 1) <= budget) runEnd++;
            for (int[] g : groups(i, runEnd, budget, measure, canOverlap)) {
                out.add(builder.build(g[0], g[1]));
            }
            i = runEnd + 1;
        }
        return out;
    }

    private List<int[]> groups(int from, int to, int budget, IntBinaryOperator measure, IntPredicate canOverlap) {
        List<int[]> out = new ArrayList<>();
        int i = from;
        int prevEnd = from - 1;
        while (true) {
            int lo = i;
            int hi = to;
            while (lo < hi) {
                int mid = (lo + hi + 1) >>> 1;
                if (measure.applyAsInt(i, mid) <= budget) lo = mid;
                else hi = mid - 1;
            }
            int j = Math.max(lo, prevEnd + 1);
            out.add(new int[]{i, j});
            prevEnd = j;
            if (j >= to) break;

            int next = j + 1;
            if (params.overlapTokens() > 0) {
                for (int k = j; k > i; k--) {
                    if (!canOverlap.test(k)
                            || measure.applyAsInt(k, j) > params.overlapTokens()
                            || measure.applyAsInt(k, j + 1) > budget) {
                        break;
                    }
                    next = k;
                }
            }
            i = next;
        }
        return out;
    }

    Piece forceTruncate(String body, Span span, ChunkType type) {
        String raw = span.of(body);
        String text = truncateToFit(raw);
        return Piece.synthetic(span.start(), span.end(), text, tokens.count(text), type, FORCE_TRUNCATE)
                .withMeta("force_truncate", true)
                .withMeta("raw_chars", raw.length());
    }

    /**
     * Longest prefix that fits with the truncation marker appended, found by binary search.
     */
    String truncateToFit(String text) {
        if (tokens.count(text) <= hardMax) return text;
        int lo = 0;
        int hi = text.length();
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (tokens.count(text.substring(0, mid) + TRUNCATION_MARKER) <= hardMax) lo = mid;
            else hi = mid - 1;
        }
        return text.substring(0, lo) + TRUNCATION_MARKER;
    }

    private Piece verbatim(String body, List<Span> units, int from, int to, ChunkType type, String strategy) {
        int start = units.get(from).start();
        int end = units.get(to).end();
        return Piece.verbatim(body, start, end, tokens.count(body.substring(start, end)), type, strategy);
    }

    private IntBinaryOperator measure(String body, List<Span> units) {
        return (f, t) -> tokens.count(body.substring(units.get(f).start(), units.get(t).end()));
    }

    private static ChunkType typeOf(String body, List<Block> blocks, int from, int to) {
        boolean allCode = true;
        boolean allTable = true;
        for (int k = from; k <= to; k++) {
            allCode &= blocks.get(k).kind() == Block.Kind.CODE;
            allTable &= blocks.get(k).kind() == Block.Kind.TABLE;
        }
        if (allCode) return ChunkType.CODE;
        if (allTable) return ChunkType.TABLE;
        Block first = blocks.get(from);
        if (first.kind() == Block.Kind.PARAGRAPH && Boundaries.isHeadingLine(firstLine(first.span().of(body)))) {
            return ChunkType.HEADING;
        }
        return ChunkType.PARAGRAPH;
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
