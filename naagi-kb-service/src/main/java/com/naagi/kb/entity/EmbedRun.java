package com.naagi.kb.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "embed_runs", indexes = @Index(name = "idx_embed_runs_run_id", columnList = "runId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedRun {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String runId;

    private String provider;

    private String model;

    private int dimension;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    private int totalChunks;

    private int skippedSkiplist;

    private int skippedUnchanged;

    private int embedded;

    private int inserted;

    private int batches;

    private int failedBatches;

    @Column(length = 2000)
    private String errorMessage;

    @Column(columnDefinition = "TEXT")
    private String summaryJson; // EmbedRunSummary or PreflightReport as JSON

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    private long durationMs;

    public enum Status {
        RUNNING,
        COMPLETED,
        COMPLETED_WITH_FAILURES,
        STOPPED,
        BLOCKED,
        FAILED
    }
}
