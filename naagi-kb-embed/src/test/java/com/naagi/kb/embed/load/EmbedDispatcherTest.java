package com.naagi.kb.embed.load;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbedDispatcherTest {

    private EmbedDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.shutdown();
    }

    private static EmbedRunSummary summary(String runId, boolean stopped) {
        Instant now = Instant.now();
        return new EmbedRunSummary(runId, "dummy", "m", 8, 0, 0, 0, 0, 0, 0, List.of(), stopped, now, now, 0);
    }

    /** Runner that blocks until released or stopped. */
    private static EmbedRunner blocking(CountDownLatch started, CountDownLatch release) {
        return (runId, stop) -> {
            started.countDown();
            try {
                while (!stop.getAsBoolean() && !release.await(10, TimeUnit.MILLISECONDS)) {
                    // waiting for release or stop
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return summary(runId, stop.getAsBoolean());
        };
    }

    @Test
    @DisplayName("Second submission of an active run is rejected")
    void rejectsDuplicateRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        dispatcher = new EmbedDispatcher(blocking(started, release), 2);

        CompletableFuture<EmbedRunSummary> first = dispatcher.submit("r1");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> dispatcher.submit("r1")).isInstanceOf(RunAlreadyActiveException.class);
        assertThat(dispatcher.isActive("r1")).isTrue();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).stopped()).isFalse();
        assertThat(dispatcher.isActive("r1")).isFalse();
        assertThat(dispatcher.submit("r1").get(5, TimeUnit.SECONDS).runId()).isEqualTo("r1");
    }

    @Test
    @DisplayName("Distinct runs are embedded concurrently")
    void distinctRunsInParallel() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        dispatcher = new EmbedDispatcher(blocking(started, release), 2);

        CompletableFuture<EmbedRunSummary> a = dispatcher.submit("a");
        CompletableFuture<EmbedRunSummary> b = dispatcher.submit("b");

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(dispatcher.activeRuns()).containsExactlyInAnyOrder("a", "b");
        release.countDown();
        CompletableFuture.allOf(a, b).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Stop lets the worker finish and reports stopped")
    void gracefulStop() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        dispatcher = new EmbedDispatcher(blocking(started, new CountDownLatch(1)), 1);

        CompletableFuture<EmbedRunSummary> run = dispatcher.submit("r1");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(dispatcher.stop("r1")).isTrue();
        assertThat(run.get(5, TimeUnit.SECONDS).stopped()).isTrue();
        assertThat(dispatcher.stop("r1")).isFalse();
    }

    @Test
    @DisplayName("Failure of a run releases its slot")
    void failureReleasesRun() {
        dispatcher = new EmbedDispatcher((runId, stop) -> {
            throw new IllegalStateException("boom");
        }, 1);

        CompletableFuture<EmbedRunSummary> run = dispatcher.submit("r1");

        assertThatThrownBy(() -> run.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(dispatcher.isActive("r1")).isFalse();
    }
}
