package com.naagi.kb.chunk;

import com.naagi.kb.core.model.ChunkType;
import com.naagi.kb.core.token.HeuristicTokenCounter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GluePassTest {

    private final ChunkingParams params = ChunkingParams.defaults()
            .withHardMaxTokens(40).withOverlapTokens(0).withMinTokens(10, 5);
    private final GluePass glue = new GluePass(new HeuristicTokenCounter(), params);

    @Test
    @DisplayName("Recognises heading-only and boilerplate pieces as orphans")
    void orphanHeadings() {
        assertThat(GluePass.isOrphanHeading("## Setup")).isTrue();
        assertThat(GluePass.isOrphanHeading("References:")).isTrue();
        assertThat(GluePass.isOrphanHeading("Some text about setup")).isFalse();
        assertThat(GluePass.isOrphanHeading("# Setup\nBody")).isFalse();
    }

    @Test
    @DisplayName("Undersized piece merges forward and keeps the covered substring")
    void mergesForward() {
        String body = "# Setup\n\nInstall the agent and restart the service.";
        Piece heading = Piece.verbatim(body, 0, 7, 2, ChunkType.HEADING, "paragraph");
        Piece para = Piece.verbatim(body, 9, body.length(), 11, ChunkType.PARAGRAPH, "paragraph");

        List<Piece> out = glue.apply(body, List.of(heading, para));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).text()).isEqualTo(body);
        assertThat(out.get(0).strategy()).isEqualTo("paragraph+glue");
        assertThat(out.get(0).meta()).containsEntry("glued_from", 2);
    }

    @Test
    @DisplayName("Merge that would exceed the cap is refused and the reason recorded")
    void refusesOverCap() {
        String big = "x".repeat(158);
        String body = big + "\n\nok";
        Piece first = Piece.verbatim(body, 0, 158, 40, ChunkType.PARAGRAPH, "paragraph");
        Piece tail = Piece.verbatim(body, 160, 162, 1, ChunkType.PARAGRAPH, "paragraph");

        List<Piece> out = glue.apply(body, List.of(first, tail));

        assertThat(out).hasSize(2);
        assertThat(out.get(1).meta())
                .containsEntry("tail_small", true)
                .containsEntry("below_hard_min_reason", GluePass.REASON_MERGE_WOULD_EXCEED_CAP);
    }

    @Test
    @DisplayName("Overlapping synthetic pieces are never concatenated")
    void overlappingSynthetic() {
        String body = "| a | b |\n|---|---|\n| 1 | 2 |\n| 3 | 4 |";
        Piece a = Piece.synthetic(0, 30, "| a | b |\n|---|---|\n| 1 | 2 |", 8, ChunkType.TABLE, "table-rows");
        Piece b = Piece.synthetic(20, body.length(), "| a | b |\n|---|---|\n| 3 | 4 |", 8, ChunkType.TABLE, "table-rows");

        assertThat(glue.merge(body, a, b)).isNull();
    }

    @Test
    @DisplayName("Coverage ignores whitespace-only gaps")
    void coverage() {
        String body = "alpha\n\nbeta gamma";
        Piece a = Piece.verbatim(body, 0, 5, 2, ChunkType.PARAGRAPH, "paragraph");
        Piece b = Piece.verbatim(body, 7, 11, 1, ChunkType.PARAGRAPH, "paragraph");

        Coverage c = Coverage.of(body, List.of(a, b));

        assertThat(c.gaps()).containsExactly(new Coverage.Gap(11, body.length()));
        assertThat(c.ratio()).isLessThan(1.0);
        assertThat(Coverage.of(body, List.of(a, Piece.verbatim(body, 7, body.length(), 3, ChunkType.PARAGRAPH, "p"))).ratio())
                .isEqualTo(1.0);
    }
}
