package com.naagi.kb.embed.preflight;

import com.naagi.kb.core.event.InMemoryEventSink;
import com.naagi.kb.core.io.ChunkRecordWriter;
import com.naagi.kb.core.io.NdjsonFiles;
import com.naagi.kb.core.run.RunLayout;
import com.naagi.kb.embed.TestChunks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PreflightCheckerTest {

    @TempDir
    Path runsRoot;

    private RunLayout layout;
    private InMemoryEventSink events;
    private PreflightChecker checker;
    private final PreflightSettings settings =
            new PreflightSettings("dummy", "dummy-sha256", 384, 1, 0.60, "heuristic", 80);

    @BeforeEach
    void setUp() {
        layout = new RunLayout(runsRoot);
        events = new InMemoryEventSink();
        checker = new PreflightChecker(layout, runId -> events);
    }

    private void writeChunks(String runId) throws Exception {
        try (ChunkRecordWriter w = new ChunkRecordWriter(layout.chunksFile(runId))) {
            w.writeAll(TestChunks.corpus(3, 2));
        }
    }

    private void writeEnriched(String runId, double... quality) throws Exception {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < quality.length; i++) {
            sb.append(String.format(Locale.ROOT,
                    "{\"doc_id\":\"doc-%d\",\"title\":\"T\",\"source_system\":\"confluence\",\"body_text\":\"x\",\"quality_score\":%.2f}%n",
                    i, quality[i]));
        }
        Path f = layout.enrichedFile(runId);
        Files.createDirectories(f.getParent());
        Files.writeString(f, sb.toString());
    }

    @Test
    @DisplayName("Missing enriched text blocks with exactly MISSING_ENRICH")
    void missingEnrich() throws Exception {
        writeChunks("r1");

        PreflightReport report = checker.check("r1", settings);

        assertThat(report.status()).isEqualTo(PreflightStatus.BLOCKED);
        assertThat(report.reasons()).containsExactly(PreflightReason.MISSING_ENRICH);
        assertThat(Files.readString(layout.preflightFile("r1")))
                .contains("\"status\" : \"BLOCKED\"")
                .contains("MISSING_ENRICH")
                .doesNotContain("QUALITY_GATE");
    }

    @Test
    @DisplayName("A malformed enriched file blocks with MISSING_ENRICH instead of failing")
    void malformedEnrich() throws Exception {
        writeEnriched("r6", 0.9);
        Files.writeString(layout.enrichedFile("r6"), "{\"doc_id\":\"broken\", not json\n",
                StandardOpenOption.APPEND);
        writeChunks("r6");

        PreflightReport report = checker.check("r6", settings);

        assertThat(report.status()).isEqualTo(PreflightStatus.BLOCKED);
        assertThat(report.reasons()).containsExactly(PreflightReason.MISSING_ENRICH);
        assertThat(report.embeddableDocs()).isZero();
        assertThat(layout.preflightFile("r6")).exists();
        assertThat(events.named("preflight.complete")).hasSize(1);
    }

    @Test
    @DisplayName("A malformed chunks file blocks with MISSING_CHUNKS")
    void malformedChunks() throws Exception {
        writeEnriched("r7", 0.9, 0.9, 0.9);
        writeChunks("r7");
        Files.writeString(layout.chunksFile("r7"), "{truncated\n", StandardOpenOption.APPEND);

        PreflightReport report = checker.check("r7", settings);

        assertThat(report.status()).isEqualTo(PreflightStatus.BLOCKED);
        assertThat(report.reasons()).containsExactly(PreflightReason.MISSING_CHUNKS);
        assertThat(report.totalChunks()).isZero();
    }

    @Test
    @DisplayName("Low-quality documents go on the skip list without blocking")
    void skipListIsAdvisory() throws Exception {
        writeEnriched("r2", 0.9, 0.3, 0.8);
        writeChunks("r2");

        PreflightReport report = checker.check("r2", settings);

        assertThat(report.isReady()).isTrue();
        assertThat(report.reasons()).isEmpty();
        assertThat(report.skipList()).containsExactly("doc-1");
        assertThat(report.embeddableDocs()).isEqualTo(2);
        assertThat(report.totalChunks()).isEqualTo(6);
        assertThat(report.belowThresholdPct()).isEqualTo(100.0);

        SkipList written = NdjsonFiles.readJson(layout.skipListFile("r2"), SkipList.class);
        assertThat(written.docIds()).containsExactly("doc-1");
        assertThat(events.named("preflight.complete")).singleElement()
                .satisfies(e -> assertThat(e.field("status")).isEqualTo("READY"));
    }

    @Test
    @DisplayName("All documents skipped blocks with EMBEDDABLE_DOCS_ZERO")
    void nothingEmbeddable() throws Exception {
        writeEnriched("r3", 0.1, 0.2, 0.3);
        writeChunks("r3");

        PreflightReport report = checker.check("r3", settings);

        assertThat(report.reasons()).containsExactly(PreflightReason.EMBEDDABLE_DOCS_ZERO);
    }

    @Test
    @DisplayName("Unknown tokenizer and invalid configuration are structural reasons")
    void tokenizerAndConfig() throws Exception {
        writeEnriched("r4", 0.9);
        writeChunks("r4");
        PreflightSettings bad = new PreflightSettings("openai", "gpt-4o", 0, 1, 0.6, "sentencepiece", 80);

        PreflightReport report = checker.check("r4", bad);

        assertThat(report.reasons())
                .containsExactly(PreflightReason.TOKENIZER_MISSING, PreflightReason.CONFIG_INVALID);
        assertThat(report.configProblems()).hasSize(2);
    }

    @Test
    @DisplayName("Plan splits runs into ready and blocked")
    void plan() throws Exception {
        writeEnriched("ok", 0.9, 0.9, 0.9);
        writeChunks("ok");

        PlanReport plan = checker.plan(List.of("ok", "empty"), settings);

        assertThat(plan.ready()).containsExactly("ok");
        assertThat(plan.blocked()).containsOnlyKeys("empty");
        assertThat(plan.blocked().get("empty"))
                .containsExactly(PreflightReason.MISSING_ENRICH, PreflightReason.MISSING_CHUNKS);
        assertThat(plan.embeddableDocs()).isEqualTo(3);
    }
}
