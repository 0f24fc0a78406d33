package com.naagi.kb.embed.retry;

import com.naagi.kb.embed.llm.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff with jitter for provider calls.
 * Only {@link ProviderException}s flagged retryable are retried; anything else propagates at once.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    public static final double DEFAULT_JITTER_RATIO = 0.2;

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final double jitterRatio;
    private final Sleeper sleeper;
    private final Random random;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
                       double jitterRatio) {
        this(maxAttempts, initialBackoff, multiplier, maxBackoff, jitterRatio,
                d -> Thread.sleep(d.toMillis()), new Random());
    }

    private RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
                        double jitterRatio, Sleeper sleeper, Random random) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (jitterRatio < 0 || jitterRatio >= 1) throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("expected 0 <= initialBackoff <= maxBackoff");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.jitterRatio = jitterRatio;
        this.sleeper = sleeper;
        this.random = random;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MULTIPLIER,
                DEFAULT_MAX_BACKOFF, DEFAULT_JITTER_RATIO);
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, jitterRatio, sleeper, random);
    }

    public RetryPolicy withRandom(Random random) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, jitterRatio, sleeper, random);
    }

    /**
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     * @throws ProviderException       for the first non-retryable provider error
     */
    public <T> T execute(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ProviderException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    throw new RetryExhaustedException(operation, attempt, e);
                }
                Duration wait = backoffFor(attempt);
                log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                        operation, attempt, maxAttempts, e.getMessage(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation, attempt, e);
                }
            }
        }
    }

    /**
     * Delay after the given failed attempt (1-based): {@code initial * multiplier^(attempt-1)},
     * capped at {@code maxBackoff}, then spread by {@code ±jitterRatio}.
     */
    public Duration backoffFor(int attempt) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        base = Math.min(base, maxBackoff.toMillis());
        double jitter = jitterRatio == 0 ? 0 : base * jitterRatio * (2 * random.nextDouble() - 1);
        long millis = Math.round(Math.min(maxBackoff.toMillis(), Math.max(0, base + jitter)));
        return Duration.ofMillis(millis);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
