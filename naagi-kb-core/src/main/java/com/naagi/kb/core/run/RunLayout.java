package com.naagi.kb.core.run;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves the artifact paths of a run under {@code <runsRoot>/<runId>/}.
 */
public final class RunLayout {

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path runsRoot;

    public RunLayout(Path runsRoot) {
        this.runsRoot = Objects.requireNonNull(runsRoot, "runsRoot");
    }

    public Path runsRoot() {
        return runsRoot;
    }

    public Path runDir(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid runId: " + runId);
        }
        return runsRoot.resolve(runId);
    }

    public Path enrichedFile(String runId) {
        return runDir(runId).resolve("enrich").resolve("enriched.jsonl");
    }

    public Path chunksFile(String runId) {
        return runDir(runId).resolve("chunk").resolve("chunks.ndjson");
    }

    public Path chunkAssuranceFile(String runId) {
        return runDir(runId).resolve("chunk").resolve("chunk_assurance.json");
    }

    public Path preflightFile(String runId) {
        return runDir(runId).resolve("preflight").resolve("preflight.json");
    }

    public Path skipListFile(String runId) {
        return runDir(runId).resolve("preflight").resolve("doc_skiplist.json");
    }

    public Path embedSummaryFile(String runId) {
        return runDir(runId).resolve("embed").resolve("embed_summary.json");
    }

    public Path eventsFile(String runId) {
        return runDir(runId).resolve("events.ndjson");
    }

    /** Artifact exists and holds at least one byte. */
    public static boolean hasContent(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }
}
