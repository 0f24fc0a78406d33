package com.naagi.kb.embed.llm;

/**
 * An embedding provider call failed. Rate limiting, server errors and I/O failures are
 * retryable; malformed requests and responses are not.
 */
public class ProviderException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final boolean retryable;
    private final int statusCode;

    public ProviderException(String message, boolean retryable, int statusCode) {
        this(message, retryable, statusCode, null);
    }

    public ProviderException(String message, boolean retryable, int statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public static ProviderException forStatus(String provider, int status, String body) {
        boolean retryable = status == 429 || status / 100 == 5;
        return new ProviderException(provider + " embed HTTP " + status + ": " + abbreviate(body), retryable, status);
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
