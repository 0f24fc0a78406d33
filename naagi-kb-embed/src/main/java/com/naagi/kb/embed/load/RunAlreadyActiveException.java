package com.naagi.kb.embed.load;

public class RunAlreadyActiveException extends RuntimeException {

    private final String runId;

    public RunAlreadyActiveException(String runId) {
        super("Embedding already in progress for run " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
