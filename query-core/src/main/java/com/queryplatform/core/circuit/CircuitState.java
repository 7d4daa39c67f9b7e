package com.queryplatform.core.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
