package com.naagi.kb.embed.retry;

public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempt(s): " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
