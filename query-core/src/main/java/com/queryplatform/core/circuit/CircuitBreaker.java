package com.queryplatform.core.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Failure-isolation state machine for one scope.
 *
 * <p><strong>Transitions:</strong>
 * <ul>
 *   <li>CLOSED: every request allowed; {@code failureThreshold} consecutive failures open the
 *       circuit, a success resets the run.</li>
 *   <li>OPEN: requests refused until {@code resetTimeout} has passed since the last failure; the
 *       first {@link #allowRequest()} after that moves to HALF_OPEN with zeroed counters and is
 *       admitted as the probe.</li>
 *   <li>HALF_OPEN: one probe at a time. A failure reopens immediately; successes accumulate until
 *       {@code successThreshold} closes the circuit.</li>
 * </ul>
 *
 * <p>The open callback fires once per transition into OPEN, outside the breaker's monitor.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String scope;
    private final CircuitBreakerOptions options;
    private final Clock clock;
    private final CircuitOpenListener onOpen;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureAt;
    private CircuitPermit probe;

    public CircuitBreaker(String scope, CircuitBreakerOptions options, Clock clock) {
        this(scope, options, clock, null);
    }

    public CircuitBreaker(String scope, CircuitBreakerOptions options, Clock clock, CircuitOpenListener onOpen) {
        this.scope   = scope;
        this.options = options;
        this.clock   = clock;
        this.onOpen  = onOpen;
    }

    /**
     * Whether a request may proceed now. In OPEN this is where the reset timeout is checked, so
     * the HALF_OPEN transition happens lazily on the first caller after the timeout.
     *
     * <p>Concurrent callers sharing a scope should use {@link #tryAcquirePermission()} and the
     * permit-taking record methods instead.
     */
    public boolean allowRequest() {
        return tryAcquirePermission().isGranted();
    }

    /**
     * Same admission rules as {@link #allowRequest()}, but returns the permit, so the probe slot
     * stays bound to the caller that was granted it.
     */
    public synchronized CircuitPermit tryAcquirePermission() {
        switch (state) {
            case CLOSED:
                return CircuitPermit.PASS;
            case OPEN:
                Instant now = clock.instant();
                if (lastFailureAt != null && !now.isBefore(lastFailureAt.plus(options.resetTimeout()))) {
                    state        = CircuitState.HALF_OPEN;
                    failureCount = 0;
                    successCount = 0;
                    probe        = CircuitPermit.newProbe();
                    log.info("CIRCUIT_HALF_OPEN scope={}", scope);
                    return probe;
                }
                return CircuitPermit.REFUSED;
            case HALF_OPEN:
                if (probe != null || successCount >= options.successThreshold()) {
                    return CircuitPermit.REFUSED;
                }
                probe = CircuitPermit.newProbe();
                return probe;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    /** Records a success for whichever caller holds the probe slot, if any. */
    public synchronized void recordSuccess() {
        probe = null;
        countSuccess();
    }

    /**
     * Records a success for {@code permit}. In HALF_OPEN only the probe holder's success counts;
     * a request admitted before the circuit opened does not close it.
     */
    public synchronized void recordSuccess(CircuitPermit permit) {
        if (permit.isProbe()) {
            if (!holdsProbe(permit)) {
                log.debug("CIRCUIT_STALE_PROBE_SUCCESS scope={}", scope);
                return;
            }
            probe = null;
            countSuccess();
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    public void recordFailure() {
        recordFailure((Throwable) null);
    }

    /**
     * Counts a failure unless {@code error} is one of the ignored types. Releases the probe slot
     * whoever holds it.
     */
    public void recordFailure(Throwable error) {
        CircuitOpenEvent opened;
        synchronized (this) {
            probe = null;
            if (isIgnored(error)) {
                return;
            }
            opened = countFailure();
        }
        if (opened != null) {
            fireOpen(opened);
        }
    }

    /**
     * Counts a failure for {@code permit} unless {@code error} is ignored. In HALF_OPEN only the
     * probe holder's failure reopens the circuit; late failures of requests admitted earlier and
     * of stale probes are not counted.
     */
    public void recordFailure(CircuitPermit permit, Throwable error) {
        CircuitOpenEvent opened;
        synchronized (this) {
            boolean holder = holdsProbe(permit);
            if (holder) {
                probe = null;
            }
            if (isIgnored(error)) {
                return;
            }
            if (permit.isProbe() ? !holder : state == CircuitState.HALF_OPEN) {
                log.debug("CIRCUIT_FAILURE_NOT_COUNTED scope={} permit={}", scope, permit);
                return;
            }
            opened = countFailure();
        }
        if (opened != null) {
            fireOpen(opened);
        }
    }

    /**
     * Hands back a half-open probe slot whose request was abandoned before an outcome was
     * recorded, whoever holds it. No-op in other states.
     */
    public synchronized void releasePermission() {
        if (state == CircuitState.HALF_OPEN) {
            probe = null;
        }
    }

    /** Hands back the probe slot if {@code permit} holds it; otherwise a no-op. */
    public synchronized void releasePermission(CircuitPermit permit) {
        if (holdsProbe(permit)) {
            probe = null;
            log.debug("CIRCUIT_PROBE_RELEASED scope={}", scope);
        }
    }

    /** Restores CLOSED with zeroed stats. */
    public synchronized void reset() {
        state         = CircuitState.CLOSED;
        failureCount  = 0;
        successCount  = 0;
        lastFailureAt = null;
        probe         = null;
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized CircuitStats stats() {
        return new CircuitStats(state, failureCount, successCount, lastFailureAt);
    }

    public String scope() {
        return scope;
    }

    public CircuitBreakerOptions options() {
        return options;
    }

    /** Must hold the monitor. */
    private boolean holdsProbe(CircuitPermit permit) {
        return permit.isProbe() && state == CircuitState.HALF_OPEN && probe == permit;
    }

    private boolean isIgnored(Throwable error) {
        if (error != null && options.isIgnored(error)) {
            log.debug("CIRCUIT_FAILURE_IGNORED scope={} type={}", scope, error.getClass().getSimpleName());
            return true;
        }
        return false;
    }

    /** Must hold the monitor. */
    private void countSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= options.successThreshold()) {
                state        = CircuitState.CLOSED;
                failureCount = 0;
                successCount = 0;
                log.info("CIRCUIT_CLOSED scope={}", scope);
            }
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    /** Must hold the monitor. Returns the event to fire when this failure opened the circuit. */
    private CircuitOpenEvent countFailure() {
        Instant now = clock.instant();
        lastFailureAt = now;
        failureCount++;
        switch (state) {
            case CLOSED:
                return failureCount >= options.failureThreshold() ? open(now) : null;
            case HALF_OPEN:
                return open(now);
            case OPEN:
                return null;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    private CircuitOpenEvent open(Instant now) {
        state        = CircuitState.OPEN;
        successCount = 0;
        probe        = null;
        log.warn("CIRCUIT_OPEN scope={} failures={} resetTimeoutMs={}",
                 scope, failureCount, options.resetTimeout().toMillis());
        return new CircuitOpenEvent(scope, now, failureCount);
    }

    private void fireOpen(CircuitOpenEvent event) {
        if (onOpen == null) {
            return;
        }
        try {
            onOpen.onOpen(event);
        } catch (RuntimeException e) {
            log.warn("CIRCUIT_OPEN_CALLBACK_FAILED scope={}: {}", scope, e.getMessage(), e);
        }
    }
}
