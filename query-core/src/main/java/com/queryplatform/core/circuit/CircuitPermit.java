package com.queryplatform.core.circuit;

/**
 * Admission granted (or refused) by {@link CircuitBreaker#tryAcquirePermission()}.
 *
 * <p>A half-open probe permit is a fresh instance per admission; the breaker compares it by
 * identity, so only the holder can record the probe's outcome or hand the slot back.
 */
public final class CircuitPermit {

    static final CircuitPermit REFUSED = new CircuitPermit(false, false);
    static final CircuitPermit PASS    = new CircuitPermit(true, false);

    private final boolean granted;
    private final boolean probe;

    private CircuitPermit(boolean granted, boolean probe) {
        this.granted = granted;
        this.probe   = probe;
    }

    static CircuitPermit newProbe() {
        return new CircuitPermit(true, true);
    }

    public boolean isGranted() {
        return granted;
    }

    /** Whether this permit holds the half-open probe slot. */
    public boolean isProbe() {
        return probe;
    }

    @Override
    public String toString() {
        return probe ? "CircuitPermit[PROBE]" : granted ? "CircuitPermit[PASS]" : "CircuitPermit[REFUSED]";
    }
}
