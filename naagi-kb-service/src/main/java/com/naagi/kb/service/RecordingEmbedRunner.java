package com.naagi.kb.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.naagi.kb.core.json.Json;
import com.naagi.kb.embed.load.EmbedPipeline;
import com.naagi.kb.embed.load.EmbedRunSummary;
import com.naagi.kb.embed.load.EmbedRunner;
import com.naagi.kb.embed.preflight.PreflightBlockedException;
import com.naagi.kb.entity.EmbedRun;
import com.naagi.kb.entity.EmbedRun.Status;
import com.naagi.kb.metrics.KbMetrics;
import com.naagi.kb.repository.EmbedRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Runs the embedding pipeline and keeps an {@link EmbedRun} row per attempt,
 * from RUNNING to its final status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordingEmbedRunner implements EmbedRunner {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final EmbedPipeline pipeline;
    private final EmbedRunRepository repository;
    private final KbMetrics metrics;

    @Override
    public EmbedRunSummary run(String runId, BooleanSupplier stopRequested) {
        EmbedRun record = repository.save(EmbedRun.builder()
                .id(UUID.randomUUID().toString())
                .runId(runId)
                .status(Status.RUNNING)
                .createdAt(LocalDateTime.now())
                .build());
        long started = System.currentTimeMillis();

        try {
            EmbedRunSummary summary = pipeline.run(runId, stopRequested);
            apply(record, summary);
            repository.save(record);
            metrics.recordEmbedRun(summary.durationMs(), summary.embedded(), summary.skippedUnchanged(),
                    summary.failedBatches().size(), summary.stopped());
            log.info("Embedding run {} finished with status {} ({} embedded, {} unchanged, {} failed batches)",
                    runId, record.getStatus(), summary.embedded(), summary.skippedUnchanged(),
                    summary.failedBatches().size());
            return summary;
        } catch (PreflightBlockedException e) {
            record.setStatus(Status.BLOCKED);
            record.setErrorMessage(truncate("Preflight BLOCKED: " + e.getReport().reasons()));
            record.setSummaryJson(toJson(e.getReport()));
            finish(record, started);
            metrics.recordPreflightBlocked();
            throw e;
        } catch (RuntimeException e) {
            record.setStatus(Status.FAILED);
            record.setErrorMessage(truncate(e.getClass().getSimpleName() + ": " + e.getMessage()));
            finish(record, started);
            throw e;
        }
    }

    private void apply(EmbedRun record, EmbedRunSummary summary) {
        record.setProvider(summary.provider());
        record.setModel(summary.model());
        record.setDimension(summary.dimension());
        record.setTotalChunks(summary.totalChunks());
        record.setSkippedSkiplist(summary.skippedBySkipList());
        record.setSkippedUnchanged(summary.skippedUnchanged());
        record.setEmbedded(summary.embedded());
        record.setInserted(summary.inserted());
        record.setBatches(summary.batches());
        record.setFailedBatches(summary.failedBatches().size());
        record.setSummaryJson(toJson(summary));
        record.setCompletedAt(LocalDateTime.now());
        record.setDurationMs(summary.durationMs());
        if (summary.stopped()) {
            record.setStatus(Status.STOPPED);
        } else if (summary.hasFailures()) {
            record.setStatus(Status.COMPLETED_WITH_FAILURES);
        } else {
            record.setStatus(Status.COMPLETED);
        }
    }

    private void finish(EmbedRun record, long started) {
        record.setCompletedAt(LocalDateTime.now());
        record.setDurationMs(System.currentTimeMillis() - started);
        repository.save(record);
    }

    private static String toJson(Object value) {
        try {
            return Json.MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
