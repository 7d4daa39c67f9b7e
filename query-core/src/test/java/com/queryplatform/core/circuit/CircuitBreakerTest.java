package com.queryplatform.core.circuit;

import com.queryplatform.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CircuitBreaker} and {@link CircuitBreakerRegistry}.
 *
 * <p>Breakers use threshold 3 and a 10 s reset timeout unless stated otherwise.
 */
class CircuitBreakerTest {

    private static final Duration RESET = Duration.ofSeconds(10);

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private CircuitBreaker breaker(int successThreshold) {
        return new CircuitBreaker("orders",
            new CircuitBreakerOptions(3, RESET, successThreshold, Set.of()), clock);
    }

    private static void fail(CircuitBreaker breaker, int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(new IllegalStateException("down"));
        }
    }

    // ── CLOSED ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("CLOSED")
    class ClosedTests {

        @Test
        @DisplayName("2 failures → still CLOSED, 3rd failure → OPEN")
        void opensExactlyAtThreshold() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 2);
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertTrue(breaker.allowRequest());

            fail(breaker, 1);
            assertEquals(CircuitState.OPEN, breaker.state());
            assertFalse(breaker.allowRequest());
        }

        @Test
        @DisplayName("success between failures → run restarts")
        void successResetsFailureRun() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 2);
            breaker.recordSuccess();
            fail(breaker, 2);

            assertEquals(CircuitState.CLOSED, breaker.state());
            assertEquals(2, breaker.stats().failureCount());
        }

        @Test
        @DisplayName("ignored error type → not counted")
        void ignoredErrorsNotCounted() {
            CircuitBreaker breaker = new CircuitBreaker("orders",
                new CircuitBreakerOptions(1, RESET, 1, Set.of(IllegalArgumentException.class)), clock);

            breaker.recordFailure(new IllegalArgumentException("bad input"));

            assertEquals(CircuitState.CLOSED, breaker.state());
            assertEquals(0, breaker.stats().failureCount());
        }
    }

    // ── OPEN → HALF_OPEN ────────────────────────────────────────────────────

    @Nested
    @DisplayName("OPEN → HALF_OPEN")
    class RecoveryTests {

        @Test
        @DisplayName("before resetTimeout → refused, at resetTimeout → single probe admitted")
        void halfOpenAfterTimeout() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 3);

            clock.advance(RESET.minusMillis(1));
            assertFalse(breaker.allowRequest());

            clock.advance(Duration.ofMillis(1));
            assertTrue(breaker.allowRequest());
            assertEquals(CircuitState.HALF_OPEN, breaker.state());
            assertFalse(breaker.allowRequest(), "second concurrent probe must be refused");
        }

        @Test
        @DisplayName("probe succeeds → CLOSED with zeroed counters")
        void probeSuccessCloses() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 3);
            clock.advance(RESET);
            breaker.allowRequest();

            breaker.recordSuccess();

            CircuitStats stats = breaker.stats();
            assertEquals(CircuitState.CLOSED, stats.state());
            assertEquals(0, stats.failureCount());
            assertEquals(0, stats.successCount());
        }

        @Test
        @DisplayName("successThreshold 2 → two sequential probes needed")
        void successThresholdTwo() {
            CircuitBreaker breaker = breaker(2);
            fail(breaker, 3);
            clock.advance(RESET);

            assertTrue(breaker.allowRequest());
            breaker.recordSuccess();
            assertEquals(CircuitState.HALF_OPEN, breaker.state());

            assertTrue(breaker.allowRequest());
            breaker.recordSuccess();
            assertEquals(CircuitState.CLOSED, breaker.state());
        }

        @Test
        @DisplayName("probe fails → OPEN again, timeout restarts")
        void probeFailureReopens() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 3);
            clock.advance(RESET);
            breaker.allowRequest();

            fail(breaker, 1);

            assertEquals(CircuitState.OPEN, breaker.state());
            assertFalse(breaker.allowRequest());
            clock.advance(RESET);
            assertTrue(breaker.allowRequest());
        }

        @Test
        @DisplayName("abandoned probe released → next probe admitted")
        void releasePermission_freesProbe() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 3);
            clock.advance(RESET);
            assertTrue(breaker.allowRequest());

            breaker.releasePermission();

            assertTrue(breaker.allowRequest());
        }

        @Test
        @DisplayName("reset() → CLOSED, lastFailureAt cleared")
        void reset_restoresClosed() {
            CircuitBreaker breaker = breaker(1);
            fail(breaker, 3);

            breaker.reset();

            assertEquals(CircuitState.CLOSED, breaker.state());
            assertNull(breaker.stats().lastFailureAt());
        }
    }

    // ── permits ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("tryAcquirePermission() — probe ownership")
    class PermitTests {

        /** Opens the breaker, waits out the timeout, and returns the admitted probe. */
        private CircuitPermit halfOpenProbe(CircuitBreaker breaker) {
            fail(breaker, 3);
            clock.advance(RESET);
            CircuitPermit probe = breaker.tryAcquirePermission();
            assertTrue(probe.isProbe());
            return probe;
        }

        @Test
        @DisplayName("CLOSED → granted, not a probe; OPEN → refused")
        void permitKinds() {
            CircuitBreaker breaker = breaker(1);
            CircuitPermit pass = breaker.tryAcquirePermission();
            assertTrue(pass.isGranted());
            assertFalse(pass.isProbe());

            fail(breaker, 3);

            assertFalse(breaker.tryAcquirePermission().isGranted());
        }

        @Test
        @DisplayName("permit from before the circuit opened released → probe slot still held")
        void releaseOfOtherPermit_keepsProbe() {
            CircuitBreaker breaker = breaker(1);
            CircuitPermit early = breaker.tryAcquirePermission();
            halfOpenProbe(breaker);

            breaker.releasePermission(early);

            assertFalse(breaker.tryAcquirePermission().isGranted());
        }

        @Test
        @DisplayName("probe holder releases → next probe admitted")
        void releaseByHolder_freesProbe() {
            CircuitBreaker breaker = breaker(1);
            CircuitPermit probe = halfOpenProbe(breaker);

            breaker.releasePermission(probe);

            assertTrue(breaker.tryAcquirePermission().isProbe());
        }

        @Test
        @DisplayName("late outcomes of an earlier request in HALF_OPEN → not counted as the probe's")
        void earlierRequestOutcomes_ignoredInHalfOpen() {
            CircuitBreaker breaker = breaker(1);
            CircuitPermit early = breaker.tryAcquirePermission();
            halfOpenProbe(breaker);

            breaker.recordSuccess(early);
            assertEquals(CircuitState.HALF_OPEN, breaker.state());
            breaker.recordFailure(early, new IllegalStateException("late"));
            assertEquals(CircuitState.HALF_OPEN, breaker.state());
            assertFalse(breaker.tryAcquirePermission().isGranted(), "probe still in flight");
        }

        @Test
        @DisplayName("stale probe from a previous cycle → outcome ignored")
        void staleProbe_ignored() {
            CircuitBreaker breaker = breaker(1);
            CircuitPermit stale = halfOpenProbe(breaker);
            breaker.releasePermission(stale);
            CircuitPermit current = breaker.tryAcquirePermission();

            breaker.recordFailure(stale, new IllegalStateException("late"));
            assertEquals(CircuitState.HALF_OPEN, breaker.state());

            breaker.recordSuccess(current);
            assertEquals(CircuitState.CLOSED, breaker.state());
        }

        @Test
        @DisplayName("probe fails with an ignored type → slot freed, still HALF_OPEN")
        void ignoredProbeFailure_freesSlot() {
            CircuitBreaker breaker = new CircuitBreaker("orders",
                new CircuitBreakerOptions(1, RESET, 1, Set.of(IllegalArgumentException.class)), clock);
            breaker.recordFailure(new IllegalStateException("down"));
            clock.advance(RESET);
            CircuitPermit probe = breaker.tryAcquirePermission();

            breaker.recordFailure(probe, new IllegalArgumentException("bad input"));

            assertEquals(CircuitState.HALF_OPEN, breaker.state());
            assertTrue(breaker.tryAcquirePermission().isProbe());
        }
    }

    // ── callbacks and registry ──────────────────────────────────────────────

    @Nested
    @DisplayName("open callbacks and registry")
    class RegistryTests {

        @Test
        @DisplayName("throwing open callback → breaker still OPEN")
        void throwingCallback_isContained() {
            CircuitBreaker breaker = new CircuitBreaker("orders",
                new CircuitBreakerOptions(1, RESET, 1, Set.of()), clock,
                event -> { throw new IllegalStateException("listener bug"); });

            assertDoesNotThrow(() -> breaker.recordFailure());
            assertEquals(CircuitState.OPEN, breaker.state());
        }

        @Test
        @DisplayName("getOrCreate twice → same instance, first options win")
        void getOrCreate_returnsExisting() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);
            CircuitBreaker first = registry.getOrCreate("orders", CircuitBreakerOptions.defaults());
            CircuitBreaker second = registry.getOrCreate("orders",
                CircuitBreakerOptions.defaults().withFailureThreshold(1));

            assertSame(first, second);
            assertEquals(5, second.options().failureThreshold());
        }

        @Test
        @DisplayName("listener throws → later listeners still notified once")
        void listeners_isolatedFromEachOther() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);
            List<CircuitOpenEvent> received = new ArrayList<>();
            registry.addOpenListener(event -> { throw new IllegalStateException("listener bug"); });
            registry.addOpenListener(received::add);

            CircuitBreaker breaker = registry.getOrCreate("orders",
                CircuitBreakerOptions.defaults().withFailureThreshold(2));
            breaker.recordFailure();
            breaker.recordFailure();
            breaker.recordFailure();

            assertEquals(1, received.size());
            assertEquals("orders", received.get(0).scope());
            assertEquals(2, received.get(0).failureCount());
        }

        @Test
        @DisplayName("removed listener → not notified")
        void removeOpenListener() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);
            List<CircuitOpenEvent> received = new ArrayList<>();
            CircuitOpenListener listener = received::add;
            registry.addOpenListener(listener);
            registry.removeOpenListener(listener);

            registry.getOrCreate("orders", CircuitBreakerOptions.defaults().withFailureThreshold(1)).recordFailure();

            assertTrue(received.isEmpty());
        }
    }
}
