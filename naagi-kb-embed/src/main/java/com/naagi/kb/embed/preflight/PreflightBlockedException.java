package com.naagi.kb.embed.preflight;

public class PreflightBlockedException extends RuntimeException {

    private final PreflightReport report;

    public PreflightBlockedException(PreflightReport report) {
        super("Preflight BLOCKED for run " + report.runId() + ": " + report.reasons());
        this.report = report;
    }

    public PreflightReport getReport() {
        return report;
    }
}
