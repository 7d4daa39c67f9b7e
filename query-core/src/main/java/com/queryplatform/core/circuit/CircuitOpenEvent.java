package com.queryplatform.core.circuit;

import java.time.Instant;

/**
 * Published once per transition into {@link CircuitState#OPEN}.
 */
public record CircuitOpenEvent(String scope, Instant openedAt, int failureCount) {}
