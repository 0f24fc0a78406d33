package com.naagi.kb.embed.load;

import com.naagi.kb.core.event.EventSinkFactory;
import com.naagi.kb.core.io.NdjsonChunkSource;
import com.naagi.kb.core.io.NdjsonFiles;
import com.naagi.kb.core.run.RunLayout;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.preflight.PreflightBlockedException;
import com.naagi.kb.embed.preflight.PreflightChecker;
import com.naagi.kb.embed.preflight.PreflightReport;
import com.naagi.kb.embed.preflight.PreflightSettings;
import com.naagi.kb.embed.retry.RetryPolicy;
import com.naagi.kb.embed.store.EmbeddingStore;

import java.util.HashSet;
import java.util.function.BooleanSupplier;

/**
 * Preflight, then load a run's {@code chunks.ndjson} and write {@code embed_summary.json}.
 */
public class EmbedPipeline implements EmbedRunner {

    private final RunLayout layout;
    private final PreflightChecker preflight;
    private final PreflightSettings settings;
    private final EmbeddingsClient client;
    private final EmbeddingStore store;
    private final RetryPolicy retry;
    private final int batchSize;
    private final EventSinkFactory sinks;

    public EmbedPipeline(RunLayout layout, PreflightChecker preflight, PreflightSettings settings,
                         EmbeddingsClient client, EmbeddingStore store, RetryPolicy retry, int batchSize,
                         EventSinkFactory sinks) {
        this.layout = layout;
        this.preflight = preflight;
        this.settings = settings;
        this.client = client;
        this.store = store;
        this.retry = retry;
        this.batchSize = batchSize;
        this.sinks = sinks;
    }

    /**
     * @throws PreflightBlockedException when the run is not READY; nothing is embedded
     * @throws com.naagi.kb.embed.guard.DimensionMismatchException when the provider and store disagree
     */
    @Override
    public EmbedRunSummary run(String runId, BooleanSupplier stopRequested) {
        PreflightReport report = preflight.check(runId, settings);
        if (!report.isReady()) {
            throw new PreflightBlockedException(report);
        }
        EmbeddingLoader loader = new EmbeddingLoader(client, store, retry, batchSize, sinks.forRun(runId));
        EmbedRunSummary summary = loader.load(runId, new NdjsonChunkSource(layout.chunksFile(runId)),
                new HashSet<>(report.skipList()), stopRequested);
        NdjsonFiles.writeJson(layout.embedSummaryFile(runId), summary);
        return summary;
    }
}
