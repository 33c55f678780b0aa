package com.siafu;

import java.time.Duration;
import java.util.Objects;

/**
 * How often a failed execution is retried before the job is given up on, and how long to
 * wait between attempts. The delay before retry {@code k} (starting at 1) is
 * {@code initialBackoff * backoffMultiplier^(k-1)}.
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double backoffMultiplier) {

    private static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO, 1.0);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy none() {
        return NONE;
    }

    /** Retries right away, without any backoff. */
    public static RetryPolicy immediate(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, 1.0);
    }

    public static RetryPolicy exponential(int maxRetries, Duration initialBackoff, double backoffMultiplier) {
        return new RetryPolicy(maxRetries, initialBackoff, backoffMultiplier);
    }

    public boolean allowsRetry(int attempt) {
        return attempt <= maxRetries;
    }

    /**
     * @param attempt the retry about to be scheduled, starting at 1
     */
    public Duration backoffFor(int attempt) {
        if (initialBackoff.isZero()) {
            return Duration.ZERO;
        }
        long delayMs = (long) (initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1)));
        return Duration.ofMillis(delayMs);
    }
}
