package com.naagi.kb.embed.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs embedding jobs on a fixed worker pool. A run is embedded by at most one worker at a time;
 * distinct runs proceed in parallel.
 */
public class EmbedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EmbedDispatcher.class);

    private final EmbedRunner runner;
    private final ExecutorService workers;
    private final ConcurrentMap<String, AtomicBoolean> active = new ConcurrentHashMap<>();

    public EmbedDispatcher(EmbedRunner runner, int workerCount) {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1");
        this.runner = runner;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "embed-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws RunAlreadyActiveException when the run is already queued or being embedded
     */
    public CompletableFuture<EmbedRunSummary> submit(String runId) {
        AtomicBoolean stop = new AtomicBoolean();
        if (active.putIfAbsent(runId, stop) != null) {
            throw new RunAlreadyActiveException(runId);
        }
        try {
            return CompletableFuture.supplyAsync(() -> runner.run(runId, stop::get), workers)
                    .whenComplete((summary, error) -> {
                        active.remove(runId, stop);
                        if (error != null) {
                            log.error("Embedding run {} failed: {}", runId, error.getMessage());
                        }
                    });
        } catch (RejectedExecutionException e) {
            active.remove(runId, stop);
            throw e;
        }
    }

    /**
     * Requests a graceful stop: the in-flight batch completes, then the worker exits.
     *
     * @return false when the run is not active
     */
    public boolean stop(String runId) {
        AtomicBoolean flag = active.get(runId);
        if (flag == null) return false;
        flag.set(true);
        log.info("Stop requested for embedding run {}", runId);
        return true;
    }

    public boolean isActive(String runId) {
        return active.containsKey(runId);
    }

    public Set<String> activeRuns() {
        return Set.copyOf(active.keySet());
    }

    public void shutdown() {
        active.values().forEach(f -> f.set(true));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
