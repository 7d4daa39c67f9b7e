package com.queryplatform.core.circuit;

import java.time.Instant;

/**
 * Point-in-time counters of one {@link CircuitBreaker}.
 *
 * @param lastFailureAt {@code null} until the first recorded failure
 */
public record CircuitStats(
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureAt
) {}
