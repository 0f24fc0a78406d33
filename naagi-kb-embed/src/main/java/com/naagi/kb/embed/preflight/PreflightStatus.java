package com.naagi.kb.embed.preflight;

public enum PreflightStatus {
    PENDING,
    READY,
    BLOCKED
}
