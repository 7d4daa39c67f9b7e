package com.queryplatform.core.circuit;

import java.time.Duration;
import java.util.Set;

/**
 * Thresholds of one breaker. Applied only when the breaker is created; a later
 * {@link CircuitBreakerRegistry#getOrCreate} with different options returns the existing breaker
 * unchanged.
 *
 * @param failureThreshold  consecutive failures in CLOSED that open the circuit
 * @param resetTimeout      time after the last failure before OPEN admits a probe
 * @param successThreshold  successful probes in HALF_OPEN needed to close again
 * @param ignoredErrorTypes failures of these types (or subtypes) are not counted
 */
public record CircuitBreakerOptions(
    int failureThreshold,
    Duration resetTimeout,
    int successThreshold,
    Set<Class<? extends Throwable>> ignoredErrorTypes
) {

    public CircuitBreakerOptions {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be non-negative: " + resetTimeout);
        }
        ignoredErrorTypes = ignoredErrorTypes == null ? Set.of() : Set.copyOf(ignoredErrorTypes);
    }

    public static CircuitBreakerOptions defaults() {
        return new CircuitBreakerOptions(5, Duration.ofSeconds(60), 1, Set.of());
    }

    public CircuitBreakerOptions withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerOptions(failureThreshold, resetTimeout, successThreshold, ignoredErrorTypes);
    }

    public CircuitBreakerOptions withResetTimeout(Duration resetTimeout) {
        return new CircuitBreakerOptions(failureThreshold, resetTimeout, successThreshold, ignoredErrorTypes);
    }

    public CircuitBreakerOptions withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerOptions(failureThreshold, resetTimeout, successThreshold, ignoredErrorTypes);
    }

    public CircuitBreakerOptions withIgnoredErrorTypes(Set<Class<? extends Throwable>> ignoredErrorTypes) {
        return new CircuitBreakerOptions(failureThreshold, resetTimeout, successThreshold, ignoredErrorTypes);
    }

    public boolean isIgnored(Throwable error) {
        for (Class<? extends Throwable> type : ignoredErrorTypes) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
