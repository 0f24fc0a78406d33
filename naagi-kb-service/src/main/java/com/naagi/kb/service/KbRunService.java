package com.naagi.kb.service;

import com.naagi.kb.chunk.ChunkAssuranceReport;
import com.naagi.kb.chunk.ChunkRunner;
import com.naagi.kb.core.event.EmitFailureChannel;
import com.naagi.kb.embed.load.EmbedDispatcher;
import com.naagi.kb.embed.preflight.PlanReport;
import com.naagi.kb.embed.preflight.PreflightBlockedException;
import com.naagi.kb.embed.preflight.PreflightChecker;
import com.naagi.kb.embed.preflight.PreflightReport;
import com.naagi.kb.embed.preflight.PreflightSettings;
import com.naagi.kb.entity.EmbedRun;
import com.naagi.kb.metrics.KbMetrics;
import com.naagi.kb.repository.EmbedRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Run lifecycle: chunk, preflight, dispatch and stop embedding, and read back persisted summaries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KbRunService {

    private final ChunkRunner chunkRunner;
    private final PreflightChecker preflightChecker;
    private final PreflightSettings preflightSettings;
    private final EmbedDispatcher dispatcher;
    private final EmbedRunRepository embedRunRepository;
    private final EmitFailureChannel emitFailures;
    private final KbMetrics metrics;

    public ChunkAssuranceReport chunk(String runId) {
        long started = System.currentTimeMillis();
        ChunkAssuranceReport report = chunkRunner.run(runId);
        metrics.recordChunkRun(System.currentTimeMillis() - started, report.chunksTotal(), report.skippedDocs().size());
        return report;
    }

    public PreflightReport preflight(String runId) {
        PreflightReport report = preflightChecker.check(runId, preflightSettings);
        if (!report.isReady()) {
            metrics.recordPreflightBlocked();
            log.warn("Run {} is BLOCKED: {}", runId, report.reasons());
        }
        return report;
    }

    public PlanReport plan(List<String> runIds) {
        PlanReport plan = preflightChecker.plan(runIds, preflightSettings);
        log.info("Preflight plan: {} ready, {} blocked", plan.ready().size(), plan.blocked().size());
        return plan;
    }

    /**
     * Checks readiness, then queues the run on the embedding workers.
     *
     * @throws PreflightBlockedException when the run is not READY
     * @throws com.naagi.kb.embed.load.RunAlreadyActiveException when the run is already queued or running
     */
    public PreflightReport startEmbed(String runId) {
        PreflightReport report = preflight(runId);
        if (!report.isReady()) {
            throw new PreflightBlockedException(report);
        }
        dispatcher.submit(runId);
        log.info("Embedding run {} queued ({} embeddable docs, {} chunks)",
                runId, report.embeddableDocs(), report.totalChunks());
        return report;
    }

    public boolean stopEmbed(String runId) {
        return dispatcher.stop(runId);
    }

    public boolean isEmbedActive(String runId) {
        return dispatcher.isActive(runId);
    }

    public Set<String> activeEmbedRuns() {
        return dispatcher.activeRuns();
    }

    public Optional<EmbedRun> latestEmbedRun(String runId) {
        return embedRunRepository.findFirstByRunIdOrderByCreatedAtDesc(runId);
    }

    public List<EmbedRun> embedHistory(String runId) {
        return embedRunRepository.findByRunIdOrderByCreatedAtDesc(runId);
    }

    public List<EmitFailureChannel.EmitFailure> recentEmitFailures() {
        return emitFailures.recent();
    }
}
