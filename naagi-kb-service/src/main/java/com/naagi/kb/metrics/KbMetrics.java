package com.naagi.kb.metrics;

import com.naagi.kb.core.event.EmitFailureChannel;
import io.micrometer.core.instrument.*;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for chunking, embedding ingestion and retrieval.
 * Exposed to Prometheus through the actuator endpoint.
 */
@Component
public class KbMetrics {

    // Timers
    private final Timer chunkRunTimer;
    private final Timer embedRunTimer;
    private final Timer retrievalTimer;

    // Counters
    private final Counter chunksWrittenCounter;
    private final Counter docsSkippedCounter;
    private final Counter chunksEmbeddedCounter;
    private final Counter chunksUnchangedCounter;
    private final Counter failedBatchCounter;
    private final Counter preflightBlockedCounter;
    private final Counter embedRunStoppedCounter;
    private final Counter retrievalQueryCounter;
    private final Counter retrievalErrorCounter;

    private volatile long lastRetrievalTimeMs = 0;
    private volatile long lastRetrievalHits = 0;

    public KbMetrics(MeterRegistry registry, EmitFailureChannel emitFailures) {
        this.chunkRunTimer = Timer.builder("kb.chunk.run.duration")
                .description("Time to chunk a run")
                .tags("component", "chunker")
                .register(registry);

        this.embedRunTimer = Timer.builder("kb.embed.run.duration")
                .description("Time to embed a run")
                .tags("component", "embed")
                .register(registry);

        this.retrievalTimer = Timer.builder("kb.retrieval.duration")
                .description("Hybrid retrieval duration")
                .tags("operation", "retrieve")
                .register(registry);

        this.chunksWrittenCounter = Counter.builder("kb.chunks.written")
                .description("Chunks written by the chunker")
                .tags("component", "chunker")
                .register(registry);

        this.docsSkippedCounter = Counter.builder("kb.docs.skipped")
                .description("Documents the chunker skipped")
                .tags("component", "chunker")
                .register(registry);

        this.chunksEmbeddedCounter = Counter.builder("kb.chunks.embedded")
                .description("Chunks embedded and written to the store")
                .tags("component", "embed")
                .register(registry);

        this.chunksUnchangedCounter = Counter.builder("kb.chunks.unchanged")
                .description("Chunks skipped because an identical embedding exists")
                .tags("component", "embed")
                .register(registry);

        this.failedBatchCounter = Counter.builder("kb.embed.batches.failed")
                .description("Embedding batches that exhausted their retries")
                .tags("component", "embed")
                .register(registry);

        this.preflightBlockedCounter = Counter.builder("kb.preflight.blocked")
                .description("Preflight checks that returned BLOCKED")
                .tags("component", "preflight")
                .register(registry);

        this.embedRunStoppedCounter = Counter.builder("kb.embed.runs.stopped")
                .description("Embedding runs stopped on request")
                .tags("component", "embed")
                .register(registry);

        this.retrievalQueryCounter = Counter.builder("kb.retrieval.queries")
                .description("Retrieval queries served")
                .tags("operation", "retrieve")
                .register(registry);

        this.retrievalErrorCounter = Counter.builder("kb.retrieval.errors")
                .description("Retrieval queries that failed")
                .tags("operation", "retrieve")
                .register(registry);

        Gauge.builder("kb.events.emit.failures", emitFailures, EmitFailureChannel::count)
                .description("Events that could not be written to the event log")
                .register(registry);

        Gauge.builder("kb.last.retrieval.time.ms", this, KbMetrics::getLastRetrievalTimeMs)
                .description("Last retrieval time in milliseconds")
                .register(registry);

        Gauge.builder("kb.last.retrieval.hits", this, KbMetrics::getLastRetrievalHits)
                .description("Hits returned by the last retrieval")
                .register(registry);
    }

    public void recordChunkRun(long durationMs, int chunksWritten, int docsSkipped) {
        chunkRunTimer.record(durationMs, TimeUnit.MILLISECONDS);
        chunksWrittenCounter.increment(chunksWritten);
        docsSkippedCounter.increment(docsSkipped);
    }

    public void recordEmbedRun(long durationMs, int embedded, int unchanged, int failedBatches, boolean stopped) {
        embedRunTimer.record(durationMs, TimeUnit.MILLISECONDS);
        chunksEmbeddedCounter.increment(embedded);
        chunksUnchangedCounter.increment(unchanged);
        if (failedBatches > 0) {
            failedBatchCounter.increment(failedBatches);
        }
        if (stopped) {
            embedRunStoppedCounter.increment();
        }
    }

    public void recordPreflightBlocked() {
        preflightBlockedCounter.increment();
    }

    public void recordRetrieval(long durationMs, int hits) {
        this.lastRetrievalTimeMs = durationMs;
        this.lastRetrievalHits = hits;
        retrievalTimer.record(durationMs, TimeUnit.MILLISECONDS);
        retrievalQueryCounter.increment();
    }

    public void recordRetrievalError() {
        retrievalErrorCounter.increment();
    }

    public long getLastRetrievalTimeMs() {
        return lastRetrievalTimeMs;
    }

    public long getLastRetrievalHits() {
        return lastRetrievalHits;
    }
}
