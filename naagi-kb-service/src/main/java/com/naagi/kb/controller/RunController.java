package com.naagi.kb.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.naagi.kb.chunk.ChunkAssuranceReport;
import com.naagi.kb.core.event.EmitFailureChannel;
import com.naagi.kb.core.io.MissingArtifactException;
import com.naagi.kb.embed.load.RunAlreadyActiveException;
import com.naagi.kb.embed.preflight.PreflightBlockedException;
import com.naagi.kb.embed.preflight.PreflightReport;
import com.naagi.kb.entity.EmbedRun;
import com.naagi.kb.service.KbRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run lifecycle endpoints: chunk a run, check readiness, dispatch and stop embedding, read summaries.
 */
@RestController
@RequestMapping("/api/kb")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Runs", description = "Chunking and embedding ingestion of run directories")
@CrossOrigin(origins = "*")
public class RunController {

    private final KbRunService runService;

    @PostMapping("/runs/{runId}/chunk")
    @Operation(summary = "Chunk the enriched documents of a run")
    public ResponseEntity<?> chunk(@PathVariable String runId) {
        log.info("Chunk request for run {}", runId);
        try {
            ChunkAssuranceReport report = runService.chunk(runId);
            return ResponseEntity.ok(report);
        } catch (MissingArtifactException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Chunking run {} failed", runId, e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Chunking failed: " + e.getMessage()));
        }
    }

    @PostMapping("/runs/{runId}/preflight")
    @Operation(summary = "Check whether a run is ready to embed")
    public ResponseEntity<?> preflight(@PathVariable String runId) {
        try {
            return ResponseEntity.ok(runService.preflight(runId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Preflight for run {} failed", runId, e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Preflight failed: " + e.getMessage()));
        }
    }

    @PostMapping("/preflight/plan")
    @Operation(summary = "Preflight a list of runs")
    public ResponseEntity<?> plan(@RequestBody PlanRequest request) {
        if (request.runIds() == null || request.runIds().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "run_ids is required"));
        }
        try {
            return ResponseEntity.ok(runService.plan(request.runIds()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Preflight plan failed", e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Preflight plan failed: " + e.getMessage()));
        }
    }

    @PostMapping("/runs/{runId}/embed")
    @Operation(summary = "Queue a run for embedding")
    public ResponseEntity<?> embed(@PathVariable String runId) {
        log.info("Embed request for run {}", runId);
        try {
            PreflightReport report = runService.startEmbed(runId);
            Map<String, Object> response = new HashMap<>();
            response.put("run_id", runId);
            response.put("status", "QUEUED");
            response.put("preflight", report);
            response.put("summary_endpoint", "/api/kb/runs/" + runId + "/embed");
            return ResponseEntity.accepted().body(response);
        } catch (PreflightBlockedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", e.getMessage(),
                    "preflight", e.getReport()));
        } catch (RunAlreadyActiveException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Could not dispatch embedding run {}", runId, e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Dispatch failed: " + e.getMessage()));
        }
    }

    @PostMapping("/runs/{runId}/embed/stop")
    @Operation(summary = "Stop an embedding run after its in-flight batch")
    public ResponseEntity<Map<String, Object>> stopEmbed(@PathVariable String runId) {
        if (!runService.stopEmbed(runId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No active embedding run: " + runId));
        }
        return ResponseEntity.ok(Map.of("run_id", runId, "stopping", true));
    }

    @GetMapping("/runs/{runId}/embed")
    @Operation(summary = "Latest embedding summary of a run")
    public ResponseEntity<?> latestEmbed(@PathVariable String runId) {
        Optional<EmbedRun> latest = runService.latestEmbedRun(runId);
        if (latest.isPresent()) {
            return ResponseEntity.ok(latest.get());
        }
        if (runService.isEmbedActive(runId)) {
            return ResponseEntity.ok(Map.of("runId", runId, "status", "QUEUED"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No embedding summary for run: " + runId));
    }

    @GetMapping("/runs/{runId}/embed/history")
    @Operation(summary = "All embedding summaries of a run")
    public ResponseEntity<List<EmbedRun>> embedHistory(@PathVariable String runId) {
        return ResponseEntity.ok(runService.embedHistory(runId));
    }

    @GetMapping("/embed/active")
    @Operation(summary = "Runs currently queued or embedding")
    public ResponseEntity<Map<String, Object>> activeEmbeds() {
        return ResponseEntity.ok(Map.of("active_runs", runService.activeEmbedRuns()));
    }

    @GetMapping("/events/failures")
    @Operation(summary = "Recent event log write failures")
    public ResponseEntity<List<EmitFailureChannel.EmitFailure>> emitFailures() {
        return ResponseEntity.ok(runService.recentEmitFailures());
    }

    public record PlanRequest(@JsonProperty("run_ids") List<String> runIds) {}
}
