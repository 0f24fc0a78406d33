package com.naagi.kb.chunk;

import com.naagi.kb.core.event.InMemoryEventSink;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.core.model.ChunkType;
import com.naagi.kb.core.model.Document;
import com.naagi.kb.core.model.Section;
import com.naagi.kb.core.token.HeuristicTokenCounter;
import com.naagi.kb.core.token.TokenCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HybridChunkerTest {

    private final TokenCounter tokens = new HeuristicTokenCounter();
    private InMemoryEventSink events;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventSink();
    }

    private HybridChunker chunker(ChunkingParams params) {
        return new HybridChunker(tokens, params, events);
    }

    private static Document doc(String id, String body) {
        return new Document(id, "Title " + id, "https://wiki.example.com/" + id, "confluence", body);
    }

    @Nested
    @DisplayName("Hard cap")
    class HardCap {

        @Test
        @DisplayName("Large table is split by rows with the header repeated in every chunk")
        void tableRowsRepeatHeader() {
            String header = "| Name | Region | Owner | Notes |\n|---|---|---|---|\n";
            String rows = IntStream.range(0, 50)
                    .mapToObj(i -> String.format("| item-%02d | eu-west | team-%02d | %s |", i, i, "x".repeat(80)))
                    .reduce((a, b) -> a + "\n" + b)
                    .orElseThrow();
            Document d = doc("inv", "# Inventory\n\n" + header + rows);

            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", d);

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(800));
            List<Chunk> withRows = chunks.stream().filter(c -> c.text().contains("| item-")).toList();
            assertThat(withRows).hasSizeGreaterThan(1);
            assertThat(withRows).allSatisfy(c -> {
                assertThat(c.text()).contains("| Name | Region | Owner | Notes |");
                assertThat(c.meta()).containsKey("table_rows");
            });
            IntStream.range(0, 50).forEach(i -> assertThat(withRows)
                    .anySatisfy(c -> assertThat(c.text()).contains(String.format("| item-%02d |", i))));
        }

        @Test
        @DisplayName("Prose without punctuation falls back to overlapping token windows")
        void unpunctuatedProse() {
            String body = "word ".repeat(2000).strip();

            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", doc("prose", body));

            assertThat(chunks).hasSizeGreaterThan(2);
            assertThat(chunks).allSatisfy(c -> {
                assertThat(c.tokenCount()).isLessThanOrEqualTo(800);
                assertThat(c.chunkType()).isEqualTo(ChunkType.TOKEN_WINDOW);
            });
            assertThat(chunks.get(0).charStart()).isZero();
            assertThat(chunks.get(chunks.size() - 1).charEnd()).isEqualTo(body.length());
            for (int i = 1; i < chunks.size(); i++) {
                assertThat(chunks.get(i).charStart()).isLessThan(chunks.get(i - 1).charEnd());
            }
        }

        @Test
        @DisplayName("Oversized code block keeps its fence and language in every piece")
        void codeFencesPreserved() {
            String code = IntStream.range(0, 60)
                    .mapToObj(i -> String.format("int value%02d = compute(%d);", i, i))
                    .reduce((a, b) -> a + "\n" + b)
                    .orElseThrow();
            ChunkingParams params = ChunkingParams.defaults()
                    .withHardMaxTokens(100).withOverlapTokens(10).withMinTokens(20, 10);

            List<Chunk> chunks = chunker(params).chunk("run-1", doc("code", "```java\n" + code + "\n```"));

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allSatisfy(c -> {
                assertThat(c.chunkType()).isEqualTo(ChunkType.CODE);
                assertThat(c.text()).startsWith("```java\n").endsWith("```");
                assertThat(c.tokenCount()).isLessThanOrEqualTo(100);
            });
        }

        @Test
        @DisplayName("A single unsplittable token run is force-truncated with a marker")
        void forceTruncate() {
            ChunkingParams params = ChunkingParams.defaults()
                    .withHardMaxTokens(50).withOverlapTokens(5).withMinTokens(20, 10);

            List<Chunk> chunks = chunker(params).chunk("run-1", doc("blob", "a".repeat(1000)));

            assertThat(chunks).hasSize(1);
            Chunk c = chunks.get(0);
            assertThat(c.tokenCount()).isLessThanOrEqualTo(50);
            assertThat(c.text()).endsWith(LayeredSplitter.TRUNCATION_MARKER);
            assertThat(c.meta()).containsEntry("force_truncate", true).containsEntry("raw_chars", 1000);
            assertThat(events.named("chunk.force_truncate")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        private final String alpha = "# Alpha\n\n" + "Alpha sentence number. ".repeat(90).strip();
        private final String beta = "# Beta\n\n" + "Beta sentence number. ".repeat(90).strip();

        @Test
        @DisplayName("Splits on markdown headings when the document exceeds the cap")
        void headings() {
            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", doc("h", alpha + "\n\n" + beta));

            assertThat(chunks).hasSize(2);
            assertThat(chunks.get(0).text()).startsWith("# Alpha");
            assertThat(chunks.get(1).text()).startsWith("# Beta");
            assertThat(chunks).extracting(Chunk::splitStrategy).containsOnly(LayeredSplitter.HEADING);
            assertThat(chunks).extracting(Chunk::chunkType).containsOnly(ChunkType.HEADING);
        }

        @Test
        @DisplayName("Prefers the section map when its offsets match the text")
        void sectionMap() {
            String body = alpha + "\n\n" + beta;
            Document d = new Document("s", "Sections", "https://wiki/s", "confluence", body,
                    List.of(new Section("Alpha", 0, alpha.length()), new Section("Beta", alpha.length() + 2, null)),
                    "DEV", "guide", 0.9);

            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", d);

            assertThat(chunks).extracting(Chunk::splitStrategy).containsOnly(LayeredSplitter.SECTION_MAP);
            assertThat(chunks).allSatisfy(c -> {
                assertThat(c.meta()).containsEntry("doctype", "guide");
                assertThat(c.traceability().spaceKey()).isEqualTo("DEV");
            });
        }

        @Test
        @DisplayName("Small heading section is glued into the following section")
        void glueSmallSection() {
            String body = "# Intro\n\nShort intro.\n\n# Body\n\n" + "Body text goes here. ".repeat(130).strip()
                    + "\n\n# Tail\n\n" + "Tail text here. ".repeat(80).strip();

            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", doc("g", body));

            assertThat(chunks).hasSize(2);
            Chunk first = chunks.get(0);
            assertThat(first.text()).startsWith("# Intro").contains("# Body");
            assertThat(first.splitStrategy()).isEqualTo("heading+glue");
            assertThat(first.meta()).containsEntry("glued_from", 2);
            assertThat(chunks.get(1).text()).startsWith("# Tail");
        }
    }

    @Nested
    @DisplayName("Identity and traceability")
    class Identity {

        @Test
        @DisplayName("Small document yields one chunk with a recorded reason")
        void smallDocument() {
            List<Chunk> chunks = chunker(ChunkingParams.defaults()).chunk("run-1", doc("doc-1", "Just a line."));

            assertThat(chunks).hasSize(1);
            Chunk c = chunks.get(0);
            assertThat(c.chunkId()).isEqualTo("doc-1:0000");
            assertThat(c.ordinal()).isZero();
            assertThat(c.splitStrategy()).isEqualTo(LayeredSplitter.NO_SPLIT);
            assertThat(c.meta()).containsEntry("below_hard_min_reason", GluePass.REASON_DOCUMENT_TOO_SMALL);
            assertThat(c.traceability().title()).isEqualTo("Title doc-1");
            assertThat(events.named("chunk.emit")).hasSize(1);
        }

        @Test
        @DisplayName("Spans index the normalized text")
        void normalizesBeforeSplitting() {
            List<Chunk> chunks = chunker(ChunkingParams.defaults())
                    .chunk("run-1", doc("n", "  First\r\n\r\n\r\n\r\nSecond\u0000line  "));

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).text()).isEqualTo("First\n\nSecond line");
            assertThat(chunks.get(0).charEnd()).isEqualTo("First\n\nSecond line".length());
        }

        @Test
        @DisplayName("Blank body yields no chunks")
        void blankBody() {
            assertThat(chunker(ChunkingParams.defaults()).chunk("run-1", doc("e", "  \n "))).isEmpty();
        }

        @Test
        @DisplayName("Document without source system is rejected")
        void missingTraceability() {
            Document d = new Document("t", "Title", null, null, "Some body text.");

            assertThatThrownBy(() -> chunker(ChunkingParams.defaults()).chunk("run-1", d))
                    .isInstanceOf(ChunkingException.class)
                    .hasFieldOrPropertyWithValue("reason", "missing_traceability");
        }
    }
}
