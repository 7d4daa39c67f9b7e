package com.queryplatform.core.circuit;

import com.queryplatform.core.error.QueryPlatformException;

/**
 * A fetch was refused because its circuit is open (or its half-open probe slot is taken).
 * Never retried; always signalled to the caller of {@code fetch()}.
 */
public class CircuitBreakerOpenException extends QueryPlatformException {
    private final String circuitScope;

    public CircuitBreakerOpenException(String circuitScope) {
        super("CircuitBreaker", "circuit open scope=" + circuitScope);
        this.circuitScope = circuitScope;
    }

    public String getCircuitScope() { return circuitScope; }
}
