package com.queryplatform.core.circuit;

@FunctionalInterface
public interface CircuitOpenListener {
    void onOpen(CircuitOpenEvent event);
}
