package com.queryplatform.core.query;

import com.queryplatform.core.circuit.CircuitBreakerOpenException;

import java.time.Duration;

/**
 * Exponential backoff: retry {@code n} (1-based) waits {@code initialDelay * multiplier^(n-1)}.
 *
 * @param maxRetries retries after the first attempt; zero disables retrying
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, double multiplier) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative: " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, 1.0);
    }

    public static RetryPolicy immediate(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, 1.0);
    }

    public Duration delayFor(long retryNumber) {
        if (retryNumber <= 1 || initialDelay.isZero()) {
            return initialDelay;
        }
        double factor = Math.pow(multiplier, retryNumber - 1);
        return Duration.ofMillis((long) (initialDelay.toMillis() * factor));
    }

    /** Cancellation and open circuits are terminal; everything else may be retried. */
    public static boolean isRetryable(Throwable error) {
        return !(error instanceof CancelledException) && !(error instanceof CircuitBreakerOpenException);
    }
}
