package com.naagi.kb.embed.load;

import com.naagi.kb.core.event.InMemoryEventSink;
import com.naagi.kb.core.io.InMemoryChunkSource;
import com.naagi.kb.core.model.Chunk;
import com.naagi.kb.embed.TestChunks;
import com.naagi.kb.embed.guard.DimensionMismatchException;
import com.naagi.kb.embed.llm.DummyEmbeddingsClient;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.llm.ProviderException;
import com.naagi.kb.embed.retry.RetryPolicy;
import com.naagi.kb.embed.store.InMemoryEmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbeddingLoaderTest {

    private static final int DIM = 16;

    private InMemoryEmbeddingStore store;
    private InMemoryEventSink events;
    private RetryPolicy retry;

    @BeforeEach
    void setUp() {
        store = new InMemoryEmbeddingStore(DIM);
        events = new InMemoryEventSink();
        retry = new RetryPolicy(2, Duration.ofMillis(10), 2.0, Duration.ofMillis(50), 0.0).withSleeper(d -> { });
    }

    private EmbeddingLoader loader(EmbeddingsClient client, int batchSize) {
        return new EmbeddingLoader(client, store, retry, batchSize, events);
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Re-running on an unchanged chunk set inserts no rows")
        void rerunInsertsNothing() {
            InMemoryChunkSource source = new InMemoryChunkSource(TestChunks.corpus(10, 10));
            EmbeddingLoader loader = loader(new DummyEmbeddingsClient(DIM), 32);

            EmbedRunSummary first = loader.load("r1", source, Set.of(), () -> false);
            EmbedRunSummary second = loader.load("r1", source, Set.of(), () -> false);

            assertThat(first.inserted()).isEqualTo(100);
            assertThat(first.embedded()).isEqualTo(100);
            assertThat(second.inserted()).isZero();
            assertThat(second.embedded()).isZero();
            assertThat(second.skippedUnchanged()).isEqualTo(100);
            assertThat(store.countEmbeddings(DummyEmbeddingsClient.PROVIDER)).isEqualTo(100);
        }

        @Test
        @DisplayName("Changed chunk text is re-embedded in place")
        void changedTextIsUpdated() {
            List<Chunk> chunks = new ArrayList<>(TestChunks.corpus(1, 3));
            EmbeddingLoader loader = loader(new DummyEmbeddingsClient(DIM), 8);
            loader.load("r1", new InMemoryChunkSource(chunks), Set.of(), () -> false);

            chunks.set(1, TestChunks.chunk("doc-0", 1, "Rewritten passage."));
            EmbedRunSummary again = loader.load("r2", new InMemoryChunkSource(chunks), Set.of(), () -> false);

            assertThat(again.embedded()).isEqualTo(1);
            assertThat(again.inserted()).isZero();
            assertThat(store.chunk("doc-0:0001").text()).isEqualTo("Rewritten passage.");
        }
    }

    @Test
    @DisplayName("Dimension mismatch fails before anything is written")
    void dimensionMismatch() {
        InMemoryEmbeddingStore wide = new InMemoryEmbeddingStore(1536);
        EmbeddingLoader loader = new EmbeddingLoader(new DummyEmbeddingsClient(768), wide, retry, 10, events);

        assertThatThrownBy(() -> loader.load("r1", new InMemoryChunkSource(TestChunks.corpus(2, 2)), Set.of(), () -> false))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("expected 1536, got 768");

        assertThat(wide.countEmbeddings(DummyEmbeddingsClient.PROVIDER)).isZero();
        assertThat(wide.chunks()).isEmpty();
        assertThat(events.named("embed.start")).isEmpty();
    }

    @Test
    @DisplayName("Skip-listed documents never reach the provider")
    void skipList() {
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        when(client.provider()).thenReturn("mock");
        when(client.model()).thenReturn("m");
        when(client.declaredDimension()).thenReturn(DIM);
        when(client.embedBatch(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            List<List<Double>> out = new ArrayList<>();
            for (String t : texts) {
                assertThat(t).doesNotContain("document 1 ");
                out.add(new DummyEmbeddingsClient(DIM).embed(t));
            }
            return out;
        });

        EmbedRunSummary summary = loader(client, 4)
                .load("r1", new InMemoryChunkSource(TestChunks.corpus(3, 2)), Set.of("doc-1"), () -> false);

        assertThat(summary.totalChunks()).isEqualTo(6);
        assertThat(summary.skippedBySkipList()).isEqualTo(2);
        assertThat(summary.embedded()).isEqualTo(4);
        assertThat(store.chunk("doc-1:0000")).isNull();
    }

    @Test
    @DisplayName("A batch failing after retries is recorded and the run continues")
    void failedBatchContinues() {
        AtomicInteger calls = new AtomicInteger();
        DummyEmbeddingsClient dummy = new DummyEmbeddingsClient(DIM);
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        when(client.provider()).thenReturn("mock");
        when(client.model()).thenReturn("m");
        when(client.declaredDimension()).thenReturn(DIM);
        when(client.embedBatch(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            if (texts.get(0).contains("document 0 ")) {
                calls.incrementAndGet();
                throw new ProviderException("rate limited", true, 429);
            }
            return dummy.embedBatch(texts);
        });

        EmbedRunSummary summary = loader(client, 3)
                .load("r1", new InMemoryChunkSource(TestChunks.corpus(2, 3)), Set.of(), () -> false);

        assertThat(calls).hasValue(2);
        assertThat(summary.failedBatches()).singleElement().satisfies(fb -> {
            assertThat(fb.batchIndex()).isZero();
            assertThat(fb.docIds()).containsExactly("doc-0");
            assertThat(fb.chunkIds()).containsExactly("doc-0:0000", "doc-0:0001", "doc-0:0002");
        });
        assertThat(summary.embedded()).isEqualTo(3);
        assertThat(events.named("embed.batch_failed")).hasSize(1);
        assertThat(events.named("embed.complete")).hasSize(1);
    }

    @Test
    @DisplayName("Stop request is honoured between batches")
    void stopBetweenBatches() {
        AtomicInteger batchesSeen = new AtomicInteger();
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        DummyEmbeddingsClient dummy = new DummyEmbeddingsClient(DIM);
        when(client.provider()).thenReturn("mock");
        when(client.model()).thenReturn("m");
        when(client.declaredDimension()).thenReturn(DIM);
        when(client.embedBatch(anyList())).thenAnswer(inv -> {
            batchesSeen.incrementAndGet();
            return dummy.embedBatch(inv.getArgument(0));
        });

        EmbedRunSummary summary = loader(client, 5)
                .load("r1", new InMemoryChunkSource(TestChunks.corpus(4, 5)), Set.of(), () -> batchesSeen.get() >= 2);

        assertThat(summary.stopped()).isTrue();
        assertThat(summary.embedded()).isEqualTo(10);
        assertThat(store.countEmbeddings("mock")).isEqualTo(10);
        assertThat(events.named("embed.stopped")).hasSize(1);
    }

    @Test
    @DisplayName("Non-retryable provider errors are not retried")
    void nonRetryableFailsFast() {
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        when(client.provider()).thenReturn("mock");
        when(client.model()).thenReturn("m");
        when(client.declaredDimension()).thenReturn(DIM);
        when(client.embedBatch(anyList())).thenThrow(new ProviderException("bad request", false, 400));

        EmbedRunSummary summary = loader(client, 10)
                .load("r1", new InMemoryChunkSource(TestChunks.corpus(1, 2)), Set.of(), () -> false);

        assertThat(summary.failedBatches()).hasSize(1);
        assertThat(summary.failedBatches().get(0).error()).isEqualTo("bad request");
        verify(client, never()).embed(anyString());
    }
}
