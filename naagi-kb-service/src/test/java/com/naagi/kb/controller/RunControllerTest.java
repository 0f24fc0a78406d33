package com.naagi.kb.controller;

import com.naagi.kb.chunk.ChunkAssuranceReport;
import com.naagi.kb.chunk.SkippedDocument;
import com.naagi.kb.core.io.MissingArtifactException;
import com.naagi.kb.embed.load.RunAlreadyActiveException;
import com.naagi.kb.embed.preflight.PlanReport;
import com.naagi.kb.embed.preflight.PreflightBlockedException;
import com.naagi.kb.embed.preflight.PreflightReason;
import com.naagi.kb.embed.preflight.PreflightReport;
import com.naagi.kb.embed.preflight.PreflightStatus;
import com.naagi.kb.entity.EmbedRun;
import com.naagi.kb.entity.EmbedRun.Status;
import com.naagi.kb.service.KbRunService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for RunController.
 * Tests the run lifecycle endpoints: chunk, preflight, embed dispatch, stop and summary lookup.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private KbRunService runService;

    @Nested
    @DisplayName("POST /api/kb/runs/{runId}/chunk")
    class ChunkTests {

        @Test
        @DisplayName("Should return the chunk assurance report")
        void shouldReturnAssuranceReport() throws Exception {
            // Given
            when(runService.chunk("run-1")).thenReturn(assurance("run-1"));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/chunk", "run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.run_id").value("run-1"))
                    .andExpect(jsonPath("$.chunks_total").value(12))
                    .andExpect(jsonPath("$.skipped_docs[0].doc_id").value("doc-9"))
                    .andExpect(jsonPath("$.skipped_docs[0].reason").value("empty_body"));
        }

        @Test
        @DisplayName("Should return 404 when the run has no enriched documents")
        void shouldReturn404WhenEnrichedMissing() throws Exception {
            // Given
            when(runService.chunk("run-1"))
                    .thenThrow(new MissingArtifactException(Path.of("var/runs/run-1/enrich/enriched.jsonl")));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/chunk", "run-1"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value(containsString("enriched.jsonl")));
        }

        @Test
        @DisplayName("Should return 400 for an invalid run id")
        void shouldReturn400ForInvalidRunId() throws Exception {
            // Given
            when(runService.chunk("-bad")).thenThrow(new IllegalArgumentException("Invalid runId: -bad"));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/chunk", "-bad"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid runId: -bad"));
        }
    }

    @Nested
    @DisplayName("POST /api/kb/runs/{runId}/preflight")
    class PreflightTests {

        @Test
        @DisplayName("Should return a BLOCKED report with its reasons as 200")
        void shouldReturnBlockedReport() throws Exception {
            // Given
            when(runService.preflight("run-1"))
                    .thenReturn(report("run-1", PreflightStatus.BLOCKED, List.of(PreflightReason.MISSING_CHUNKS)));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/preflight", "run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("BLOCKED"))
                    .andExpect(jsonPath("$.reasons[0]").value("MISSING_CHUNKS"))
                    .andExpect(jsonPath("$.provider").value("dummy"));
        }
    }

    @Nested
    @DisplayName("POST /api/kb/preflight/plan")
    class PlanTests {

        @Test
        @DisplayName("Should plan the requested runs")
        void shouldPlanRuns() throws Exception {
            // Given
            PlanReport plan = new PlanReport(List.of("run-1"),
                    Map.of("run-2", List.of(PreflightReason.MISSING_ENRICH)), 4, 40);
            when(runService.plan(List.of("run-1", "run-2"))).thenReturn(plan);

            // When/Then
            mockMvc.perform(post("/api/kb/preflight/plan")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "run_ids": ["run-1", "run-2"]
                                }
                                """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ready[0]").value("run-1"))
                    .andExpect(jsonPath("$.blocked['run-2'][0]").value("MISSING_ENRICH"))
                    .andExpect(jsonPath("$.total_chunks").value(40));
        }

        @Test
        @DisplayName("Should return 400 when no run ids are given")
        void shouldRejectEmptyPlan() throws Exception {
            mockMvc.perform(post("/api/kb/preflight/plan")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("run_ids is required"));

            verifyNoInteractions(runService);
        }
    }

    @Nested
    @DisplayName("POST /api/kb/runs/{runId}/embed")
    class EmbedTests {

        @Test
        @DisplayName("Should accept a READY run")
        void shouldAcceptReadyRun() throws Exception {
            // Given
            when(runService.startEmbed("run-1")).thenReturn(report("run-1", PreflightStatus.READY, List.of()));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/embed", "run-1"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.run_id").value("run-1"))
                    .andExpect(jsonPath("$.status").value("QUEUED"))
                    .andExpect(jsonPath("$.preflight.status").value("READY"));
        }

        @Test
        @DisplayName("Should return 409 with the report when preflight is BLOCKED")
        void shouldReturn409WhenBlocked() throws Exception {
            // Given
            PreflightReport blocked = report("run-1", PreflightStatus.BLOCKED,
                    List.of(PreflightReason.EMBEDDABLE_DOCS_ZERO));
            when(runService.startEmbed("run-1")).thenThrow(new PreflightBlockedException(blocked));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/embed", "run-1"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value(containsString("EMBEDDABLE_DOCS_ZERO")))
                    .andExpect(jsonPath("$.preflight.status").value("BLOCKED"));
        }

        @Test
        @DisplayName("Should return 409 when the run is already being embedded")
        void shouldReturn409WhenActive() throws Exception {
            // Given
            when(runService.startEmbed("run-1")).thenThrow(new RunAlreadyActiveException("run-1"));

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/embed", "run-1"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("Embedding already in progress for run run-1"));
        }
    }

    @Nested
    @DisplayName("Embedding run control and summaries")
    class EmbedControlTests {

        @Test
        @DisplayName("Should request a graceful stop for an active run")
        void shouldStopActiveRun() throws Exception {
            // Given
            when(runService.stopEmbed("run-1")).thenReturn(true);

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/embed/stop", "run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.stopping").value(true));
        }

        @Test
        @DisplayName("Should return 404 when stopping a run that is not active")
        void shouldReturn404WhenStoppingInactiveRun() throws Exception {
            // Given
            when(runService.stopEmbed("run-1")).thenReturn(false);

            // When/Then
            mockMvc.perform(post("/api/kb/runs/{runId}/embed/stop", "run-1"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should return the latest persisted summary")
        void shouldReturnLatestSummary() throws Exception {
            // Given
            EmbedRun run = EmbedRun.builder()
                    .id("e-1")
                    .runId("run-1")
                    .provider("dummy")
                    .status(Status.COMPLETED)
                    .embedded(40)
                    .createdAt(LocalDateTime.now())
                    .build();
            when(runService.latestEmbedRun("run-1")).thenReturn(Optional.of(run));

            // When/Then
            mockMvc.perform(get("/api/kb/runs/{runId}/embed", "run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.embedded").value(40));
        }

        @Test
        @DisplayName("Should report QUEUED for a dispatched run without a summary yet")
        void shouldReportQueuedRun() throws Exception {
            // Given
            when(runService.latestEmbedRun("run-1")).thenReturn(Optional.empty());
            when(runService.isEmbedActive("run-1")).thenReturn(true);

            // When/Then
            mockMvc.perform(get("/api/kb/runs/{runId}/embed", "run-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("QUEUED"));
        }

        @Test
        @DisplayName("Should return 404 for an unknown summary")
        void shouldReturn404ForUnknownSummary() throws Exception {
            // Given
            when(runService.latestEmbedRun(anyString())).thenReturn(Optional.empty());
            when(runService.isEmbedActive(anyString())).thenReturn(false);

            // When/Then
            mockMvc.perform(get("/api/kb/runs/{runId}/embed", "run-404"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("No embedding summary for run: run-404"));
        }
    }

    private static ChunkAssuranceReport assurance(String runId) {
        return new ChunkAssuranceReport(runId, "heuristic", 800, 4, 3, 12, 40, 790, 410.5, 1, 0, 0, 0,
                Map.of("paragraph", 12), List.of(new SkippedDocument("doc-9", "empty_body")),
                Instant.now(), Instant.now());
    }

    private static PreflightReport report(String runId, PreflightStatus status, List<PreflightReason> reasons) {
        return new PreflightReport(runId, status, reasons, 3, 4, 12, 0.0, List.of(), List.of(),
                "dummy", "dummy-sha256", 1536, Instant.now());
    }
}
