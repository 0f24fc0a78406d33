package com.naagi.kb.embed.load;

import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.KbEvent;
import com.naagi.kb.core.io.MaterializedChunkSource;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.embed.guard.DimensionGuard;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.llm.ProviderException;
import com.naagi.kb.embed.retry.RetryExhaustedException;
import com.naagi.kb.embed.retry.RetryPolicy;
import com.naagi.kb.embed.store.EmbeddingRecord;
import com.naagi.kb.embed.store.EmbeddingStore;
import com.naagi.kb.embed.store.StoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Streams a run's materialized chunks into the store in batches.
 * <p>
 * The dimension guard runs before the first write. Skip-listed documents and chunks whose
 * content is already embedded for this provider never reach the provider. A batch that fails
 * after retries is recorded and the run moves on. A stop request is honoured between batches.
 */
public class EmbeddingLoader {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingLoader.class);

    private final EmbeddingsClient client;
    private final EmbeddingStore store;
    private final RetryPolicy retry;
    private final int batchSize;
    private final EventSink events;

    public EmbeddingLoader(EmbeddingsClient client, EmbeddingStore store, RetryPolicy retry, int batchSize,
                           EventSink events) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.client = client;
        this.store = store;
        this.retry = retry;
        this.batchSize = batchSize;
        this.events = events;
    }

    public EmbedRunSummary load(String runId, MaterializedChunkSource source, Set<String> skipDocIds,
                                BooleanSupplier stopRequested) {
        Instant startedAt = Instant.now();
        DimensionGuard guard = new DimensionGuard(client, store.expectedDimension());
        int dimension = guard.verify();

        events.emit(KbEvent.of("embed.start", runId, Map.of(
                "provider", client.provider(),
                "model", client.model(),
                "dimension", dimension,
                "source", source.describe())));
        log.info("Embedding run {} from {} with {} / {} (dim={}, batch={})",
                runId, source.describe(), client.provider(), client.model(), dimension, batchSize);

        Counts counts = new Counts();
        List<FailedBatch> failed = new ArrayList<>();
        boolean stopped = false;

        try (Stream<Chunk> chunks = source.chunks()) {
            Iterator<Chunk> it = chunks.iterator();
            List<Chunk> batch = new ArrayList<>(batchSize);
            while (true) {
                boolean more = it.hasNext();
                if (more) {
                    Chunk c = it.next();
                    counts.total++;
                    if (skipDocIds.contains(c.docId())) {
                        counts.skipList++;
                        continue;
                    }
                    batch.add(c);
                }
                if (batch.size() >= batchSize || (!more && !batch.isEmpty())) {
                    if (stopRequested.getAsBoolean()) {
                        stopped = true;
                        break;
                    }
                    processBatch(runId, counts.batches++, batch, guard, counts, failed);
                    batch = new ArrayList<>(batchSize);
                }
                if (!more) break;
            }
        }

        Instant completedAt = Instant.now();
        EmbedRunSummary summary = new EmbedRunSummary(runId, client.provider(), client.model(), dimension,
                counts.total, counts.skipList, counts.unchanged, counts.embedded, counts.inserted, counts.batches,
                failed, stopped, startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis());

        events.emit(KbEvent.of(stopped ? "embed.stopped" : "embed.complete", runId, Map.of(
                "embedded", summary.embedded(),
                "inserted", summary.inserted(),
                "unchanged", summary.skippedUnchanged(),
                "failed_batches", failed.size())));
        log.info("Embedding run {} {}: {} chunks, {} embedded ({} new), {} unchanged, {} skip-listed, {} failed batches",
                runId, stopped ? "stopped" : "complete", counts.total, counts.embedded, counts.inserted,
                counts.unchanged, counts.skipList, failed.size());
        return summary;
    }

    private void processBatch(String runId, int index, List<Chunk> batch, DimensionGuard guard,
                              Counts counts, List<FailedBatch> failed) {
        List<StoredChunk> rows = new ArrayList<>(batch.size());
        for (Chunk c : batch) rows.add(StoredChunk.from(c));

        Map<String, String> existing = store.existingContentHashes(client.provider(),
                rows.stream().map(StoredChunk::chunkId).toList());
        List<StoredChunk> pending = new ArrayList<>();
        for (StoredChunk r : rows) {
            if (r.contentSha256().equals(existing.get(r.chunkId()))) {
                counts.unchanged++;
            } else {
                pending.add(r);
            }
        }
        if (pending.isEmpty()) return;

        List<String> texts = pending.stream().map(StoredChunk::text).toList();
        List<List<Double>> vectors;
        try {
            vectors = retry.execute("embed batch " + index, () -> client.embedBatch(texts));
            if (vectors.size() != pending.size()) {
                throw new ProviderException("Provider returned " + vectors.size() + " vectors for "
                        + pending.size() + " inputs", false, ProviderException.NO_STATUS);
            }
        } catch (ProviderException | RetryExhaustedException e) {
            FailedBatch fb = new FailedBatch(index,
                    pending.stream().map(StoredChunk::chunkId).toList(),
                    pending.stream().map(StoredChunk::docId).distinct().toList(),
                    e.getMessage());
            failed.add(fb);
            events.emit(KbEvent.of("embed.batch_failed", runId, Map.of(
                    "batch_index", index, "chunks", pending.size(), "error", String.valueOf(e.getMessage()))));
            log.warn("Embedding batch {} of run {} failed: {}", index, runId, e.getMessage());
            return;
        }

        Instant now = Instant.now();
        List<EmbeddingRecord> records = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            List<Double> v = vectors.get(i);
            guard.check(v);
            StoredChunk r = pending.get(i);
            records.add(new EmbeddingRecord(r.chunkId(), client.provider(), client.model(), v.size(),
                    toFloats(v), r.contentSha256(), now));
        }

        store.upsertChunks(pending);
        int inserted = store.upsertEmbeddings(records);
        counts.embedded += records.size();
        counts.inserted += inserted;
        events.emit(KbEvent.of("embed.batch_complete", runId, Map.of(
                "batch_index", index, "embedded", records.size(), "inserted", inserted)));
        log.debug("Batch {} of run {}: {} embedded, {} new", index, runId, records.size(), inserted);
    }

    static float[] toFloats(List<Double> v) {
        float[] out = new float[v.size()];
        for (int i = 0; i < out.length; i++) out[i] = v.get(i).floatValue();
        return out;
    }

    private static final class Counts {
        int total;
        int skipList;
        int unchanged;
        int embedded;
        int inserted;
        int batches;
    }
}
