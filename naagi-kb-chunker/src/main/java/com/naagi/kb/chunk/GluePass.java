package com.naagi.kb.chunk;

import com.naagi.kb.core.model.ChunkType;
import com.naagi.kb.core.token.TokenCounter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Bottom-end control after splitting: merges undersized and heading-only pieces into a
 * neighbour while the result stays within {@code hardMaxTokens}, then records why any
 * piece is still below {@code hardMinTokens}.
 */
final class GluePass {

    static final String GLUE_SUFFIX = "+glue";

    static final String REASON_DOCUMENT_TOO_SMALL = "document_too_small";
    static final String REASON_INDIVISIBLE_BLOCK = "indivisible_block";
    static final String REASON_MERGE_WOULD_EXCEED_CAP = "merge_would_exceed_cap";

    private static final Set<String> BOILERPLATE_HEADINGS = Set.of(
            "references", "see also", "notes", "note", "todo", "tbd", "related", "related pages", "appendix");

    private final TokenCounter tokens;
    private final ChunkingParams params;

    GluePass(TokenCounter tokens, ChunkingParams params) {
        this.tokens = tokens;
        this.params = params;
    }

    List<Piece> apply(String body, List<Piece> pieces) {
        List<Piece> list = new ArrayList<>(pieces);

        int i = 0;
        while (i < list.size()) {
            Piece p = list.get(i);
            if (list.size() > 1 && needsGlue(p)) {
                if (i + 1 < list.size()) {
                    Piece merged = merge(body, p, list.get(i + 1));
                    if (merged != null) {
                        list.set(i, merged);
                        list.remove(i + 1);
                        continue;
                    }
                }
                if (i > 0) {
                    Piece merged = merge(body, list.get(i - 1), p);
                    if (merged != null) {
                        list.set(i - 1, merged);
                        list.remove(i);
                        i--;
                        continue;
                    }
                }
            }
            i++;
        }

        if (params.smallTailMerge() && list.size() > 1) {
            int last = list.size() - 1;
            if (list.get(last).tokens() < params.hardMinTokens()) {
                Piece merged = merge(body, list.get(last - 1), list.get(last));
                if (merged != null) {
                    list.set(last - 1, merged);
                    list.remove(last);
                } else {
                    list.set(last, list.get(last).withMeta("tail_small", true));
                }
            }
        }

        for (int k = 0; k < list.size(); k++) {
            Piece p = list.get(k);
            if (p.tokens() < params.hardMinTokens() && !p.meta().containsKey("below_hard_min_reason")) {
                list.set(k, p.withMeta("below_hard_min_reason", belowMinReason(list.size(), p)));
            }
        }
        return list;
    }

    private boolean needsGlue(Piece p) {
        return p.tokens() < params.softMinTokens() || (params.orphanHeadingMerge() && isOrphanHeading(p.text()));
    }

    /**
     * Merges two neighbouring pieces, or returns null when the result would exceed the cap or
     * when two non-verbatim pieces overlap (their texts cannot be joined without duplication).
     */
    Piece merge(String body, Piece a, Piece b) {
        String text;
        boolean verbatim;
        int end = Math.max(a.end(), b.end());
        if (a.verbatim() && b.verbatim() && b.start() >= a.start()) {
            text = body.substring(a.start(), end);
            verbatim = true;
        } else if (b.start() >= a.end()) {
            text = a.text() + "\n\n" + b.text();
            verbatim = false;
        } else {
            return null;
        }
        int t = tokens.count(text);
        if (t > params.hardMaxTokens()) {
            return null;
        }

        ChunkType type = a.type() == b.type() ? a.type() : (a.tokens() >= b.tokens() ? a.type() : b.type());
        if (a.type() == ChunkType.HEADING && isOrphanHeading(a.text())) {
            type = ChunkType.HEADING;
        }
        String strategy = a.strategy().endsWith(GLUE_SUFFIX) ? a.strategy() : a.strategy() + GLUE_SUFFIX;

        Map<String, Object> meta = new LinkedHashMap<>(b.meta());
        meta.putAll(a.meta());
        meta.remove("below_hard_min_reason");
        meta.remove("tail_small");
        meta.put("glued_from", gluedCount(a) + gluedCount(b));

        return new Piece(Math.min(a.start(), b.start()), end, text, t, type, strategy, meta, verbatim);
    }

    private static int gluedCount(Piece p) {
        Object v = p.meta().get("glued_from");
        return v instanceof Integer ? (Integer) v : 1;
    }

    static boolean isOrphanHeading(String text) {
        String t = text.strip();
        if (t.isEmpty() || t.indexOf('\n') >= 0) return false;
        if (t.startsWith("#")) return true;
        String word = t.toLowerCase(Locale.ROOT).replaceAll("[:\\s]+$", "");
        return BOILERPLATE_HEADINGS.contains(word);
    }

    private static String belowMinReason(int pieceCount, Piece p) {
        if (pieceCount == 1) return REASON_DOCUMENT_TOO_SMALL;
        if (p.type() == ChunkType.CODE || p.type() == ChunkType.TABLE) return REASON_INDIVISIBLE_BLOCK;
        return REASON_MERGE_WOULD_EXCEED_CAP;
    }
}
