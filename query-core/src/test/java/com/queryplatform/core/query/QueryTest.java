package com.queryplatform.core.query;

import com.queryplatform.core.MutableClock;
import com.queryplatform.core.cache.CacheConfig;
import com.queryplatform.core.circuit.CircuitBreaker;
import com.queryplatform.core.circuit.CircuitBreakerOpenException;
import com.queryplatform.core.circuit.CircuitBreakerOptions;
import com.queryplatform.core.circuit.CircuitState;
import com.queryplatform.core.model.QueryKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Query}: deduplication, retry, circuit breaking, cancellation and
 * listener lifecycle.
 *
 * <p>Fetch functions complete synchronously unless a test needs an attempt to stay in flight,
 * in which case it hands out a {@link Sinks.One} or {@code Mono.never()}.
 */
class QueryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final QueryKey KEY = QueryKey.of("todos");

    private MutableClock clock;
    private QueryClient client;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock();
        client = newClient(Duration.ofMinutes(1), 0);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private QueryClient newClient(Duration disposeDelay, int workers) {
        QueryClientConfig config = QueryClientConfig.defaults()
            .withCache(CacheConfig.defaults())
            .withDisposeDelay(disposeDelay)
            .withDefaultRetryPolicy(RetryPolicy.none())
            .withWorkerPoolSize(workers);
        return new QueryClient(config, clock, Schedulers.parallel(), null);
    }

    // ── fetch ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fetch() — deduplication and results")
    class FetchTests {

        @Test
        @DisplayName("two fetches while in flight → one call, both see the result")
        void concurrentFetches_deduplicated() {
            Sinks.One<String> source = Sinks.one();
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return source.asMono();
            });

            Mono<QueryState<String>> first = query.fetch();
            Mono<QueryState<String>> second = query.fetch();
            assertTrue(query.isFetching());
            assertEquals(QueryStatus.LOADING, query.state().status());

            source.tryEmitValue("milk");

            assertEquals("milk", first.block(TIMEOUT).data());
            assertEquals("milk", second.block(TIMEOUT).data());
            assertEquals(1, calls.get());
            assertFalse(query.isFetching());
        }

        @Test
        @DisplayName("success → SUCCESS state and cache entry written")
        void success_writesCache() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));

            QueryState<String> state = query.fetch().block(TIMEOUT);

            assertTrue(state.isSuccess());
            assertEquals(clock.instant(), state.dataUpdatedAt());
            assertEquals("milk", client.getQueryData(KEY, String.class));
        }

        @Test
        @DisplayName("stream → LOADING then SUCCESS")
        void stream_emitsTransitions() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));

            StepVerifier.create(query.stream().take(2))
                .then(query::fetch)
                .assertNext(s -> assertTrue(s.isLoading()))
                .assertNext(s -> assertEquals("milk", s.data()))
                .verifyComplete();
        }

        @Test
        @DisplayName("subscriber requests one at a time → no transition skipped")
        void stream_slowSubscriberSeesEveryTransition() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));

            StepVerifier.create(query.stream(), 1)
                .then(query::fetch)
                .assertNext(s -> assertTrue(s.isLoading()))
                .thenRequest(10)
                .assertNext(s -> assertEquals("milk", s.data()))
                .thenCancel()
                .verify(TIMEOUT);
        }

        @Test
        @DisplayName("enabled=false → no call, state unchanged")
        void disabled_neverFetches() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.just("milk");
            }, QueryOptions.<String>defaults().withEnabled(false));

            QueryState<String> state = query.fetch().block(TIMEOUT);

            assertTrue(state.isIdle());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("fresh cache entry → served without calling the function")
        void freshCache_shortCircuits() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.just("milk");
            }, QueryOptions.<String>defaults().withStaleTime(Duration.ofMinutes(1)));

            query.fetch().block(TIMEOUT);
            query.fetch().block(TIMEOUT);

            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("transformer → runs on a worker, result cached")
        void transformer_appliedOnWorkerPool() {
            QueryClient withWorkers = newClient(Duration.ofMinutes(1), 1);
            try {
                List<String> threads = new ArrayList<>();
                Query<String> query = withWorkers.getQuery(KEY, token -> Mono.just("milk"),
                    QueryOptions.<String>defaults().withTransformer(s -> {
                        threads.add(Thread.currentThread().getName());
                        return s.toUpperCase();
                    }));

                QueryState<String> state = query.fetch().block(TIMEOUT);

                assertEquals("MILK", state.data());
                assertTrue(threads.get(0).startsWith("query-worker"));
            } finally {
                withWorkers.close();
            }
        }

        @Test
        @DisplayName("setData → state and cache updated without a call")
        void setData_writesThrough() {
            Query<String> query = client.getQuery(KEY, token -> Mono.never());

            query.setData("optimistic");

            assertEquals("optimistic", query.data());
            assertEquals("optimistic", client.getQueryData(KEY));
        }
    }

    // ── errors and retry ────────────────────────────────────────────────────

    @Nested
    @DisplayName("fetch() — errors, retry and circuit breaker")
    class ErrorTests {

        @Test
        @DisplayName("fails twice, retries 2 → SUCCESS after 3 calls")
        void retry_recoversBeforeExhaustion() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> calls.incrementAndGet() < 3
                ? Mono.error(new IllegalStateException("flaky"))
                : Mono.just("milk"), QueryOptions.<String>defaults().withRetryPolicy(RetryPolicy.immediate(2)));

            QueryState<String> state = query.fetch().block(TIMEOUT);

            assertEquals("milk", state.data());
            assertEquals(3, calls.get());
            assertEquals(3, query.metrics().fetchCount());
            assertEquals(0, query.metrics().retryCount());
        }

        @Test
        @DisplayName("retries exhausted → ERROR state, onError once, Mono completes normally")
        void retry_exhausted() {
            AtomicInteger calls = new AtomicInteger();
            List<Throwable> errors = new ArrayList<>();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalStateException("down"));
            }, QueryOptions.<String>defaults()
                .withRetryPolicy(RetryPolicy.immediate(2))
                .withOnError(errors::add));

            QueryState<String> state = query.fetch().block(TIMEOUT);

            assertTrue(state.isError());
            assertEquals("down", state.error().getMessage());
            assertEquals(3, calls.get());
            assertEquals(1, errors.size());
        }

        @Test
        @DisplayName("error after data → previous data stays visible")
        void error_keepsPreviousData() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> calls.incrementAndGet() == 1
                ? Mono.just("milk")
                : Mono.error(new IllegalStateException("down")));

            query.fetch().block(TIMEOUT);
            QueryState<String> state = query.fetch().block(TIMEOUT);

            assertTrue(state.isError());
            assertEquals("milk", state.data());
        }

        @Test
        @DisplayName("breaker opened by a failure → next fetch errors with CircuitBreakerOpenException")
        void openCircuit_refusesWithoutCalling() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalStateException("down"));
            }, QueryOptions.<String>defaults().withCircuitBreaker(
                new CircuitBreakerOptions(1, Duration.ofMinutes(1), 1, Set.of())));

            assertTrue(query.fetch().block(TIMEOUT).isError());
            assertEquals(CircuitState.OPEN,
                client.circuitBreakers().get(KEY.asString()).orElseThrow().state());

            StepVerifier.create(query.fetch())
                .expectError(CircuitBreakerOpenException.class)
                .verify(TIMEOUT);
            assertEquals(1, calls.get());
            assertTrue(query.state().error() instanceof CircuitBreakerOpenException);
        }

        @Test
        @DisplayName("breaker open → retries stop at the refusal")
        void openCircuit_stopsRetrying() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalStateException("down"));
            }, QueryOptions.<String>defaults()
                .withRetryPolicy(RetryPolicy.immediate(5))
                .withCircuitBreaker(new CircuitBreakerOptions(2, Duration.ofMinutes(1), 1, Set.of())));

            StepVerifier.create(query.fetch())
                .expectError(CircuitBreakerOpenException.class)
                .verify(TIMEOUT);
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("ignored error type, repeated failures → breaker stays CLOSED, nothing counted")
        void ignoredErrorType_notCountedByBreaker() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalArgumentException("bad input"));
            }, QueryOptions.<String>defaults().withCircuitBreaker(
                new CircuitBreakerOptions(2, Duration.ofMinutes(1), 1, Set.of(IllegalArgumentException.class))));

            for (int i = 0; i < 3; i++) {
                assertTrue(query.fetch().block(TIMEOUT).isError());
            }

            CircuitBreaker breaker = client.circuitBreakers().get(KEY.asString()).orElseThrow();
            assertEquals(3, calls.get());
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertEquals(0, breaker.stats().failureCount());
        }

        @Test
        @DisplayName("shared scope, probe in flight, older query cancelled → second request still refused")
        void sharedScope_probeSlotOwnedByProbe() {
            CircuitBreakerOptions breakerOptions = new CircuitBreakerOptions(1, Duration.ofMinutes(1), 1, Set.of());
            QueryOptions<String> options = QueryOptions.<String>defaults().withCircuitBreaker("api", breakerOptions);
            AtomicInteger lateCalls = new AtomicInteger();
            Query<String> early = client.getQuery(QueryKey.of("early"), token -> Mono.never(), options);
            Query<String> failing = client.getQuery(QueryKey.of("failing"),
                token -> Mono.error(new IllegalStateException("down")), options);
            Query<String> probe = client.getQuery(QueryKey.of("probe"), token -> Mono.never(), options);
            Query<String> late = client.getQuery(QueryKey.of("late"), token -> {
                lateCalls.incrementAndGet();
                return Mono.never();
            }, options);
            CircuitBreaker breaker = client.circuitBreakers().get("api").orElseThrow();

            early.fetch();
            assertTrue(failing.fetch().block(TIMEOUT).isError());
            assertEquals(CircuitState.OPEN, breaker.state());
            clock.advance(Duration.ofMinutes(1));
            probe.fetch();
            assertEquals(CircuitState.HALF_OPEN, breaker.state());

            early.cancel();

            StepVerifier.create(late.fetch())
                .expectError(CircuitBreakerOpenException.class)
                .verify(TIMEOUT);
            assertEquals(0, lateCalls.get());

            probe.cancel();
            late.fetch();
            assertEquals(1, lateCalls.get(), "released probe slot goes to the next request");
        }
    }

    // ── cancellation ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cancel() and forced refetch")
    class CancellationTests {

        @Test
        @DisplayName("cancel in flight → token cancelled, caller gets IDLE")
        void cancel_inFlight() {
            List<CancellationToken> tokens = new ArrayList<>();
            Query<String> query = client.getQuery(KEY, token -> {
                tokens.add(token);
                return Mono.never();
            });

            Mono<QueryState<String>> pending = query.fetch();
            query.cancel();

            assertTrue(pending.block(TIMEOUT).isIdle());
            assertTrue(tokens.get(0).isCancelled());
            assertFalse(query.isFetching());
        }

        @Test
        @DisplayName("cancel after data → back to SUCCESS with that data")
        void cancel_restoresData() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> calls.incrementAndGet() == 1
                ? Mono.just("milk")
                : Mono.never());

            query.fetch().block(TIMEOUT);
            query.fetch();
            query.cancel();

            assertTrue(query.state().isSuccess());
            assertEquals("milk", query.data());
        }

        @Test
        @DisplayName("fetch(true) while in flight → old attempt cancelled, both callers get the new result")
        void forceRefetch_supersedes() {
            List<CancellationToken> tokens = new ArrayList<>();
            Query<String> query = client.getQuery(KEY, token -> {
                tokens.add(token);
                return tokens.size() == 1 ? Mono.never() : Mono.just("fresh");
            });

            Mono<QueryState<String>> first = query.fetch();
            Mono<QueryState<String>> second = query.fetch(true);

            assertEquals("fresh", second.block(TIMEOUT).data());
            assertEquals("fresh", first.block(TIMEOUT).data());
            assertTrue(tokens.get(0).isCancelled());
            assertFalse(tokens.get(1).isCancelled());
        }
    }

    // ── listeners ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("listeners and disposal")
    class ListenerTests {

        @Test
        @DisplayName("first listener → fetch triggered")
        void firstListener_fetches() {
            AtomicInteger calls = new AtomicInteger();
            Query<String> query = client.getQuery(KEY, token -> {
                calls.incrementAndGet();
                return Mono.just("milk");
            });

            try (QueryHandle<Query<String>> handle = query.acquire("view-1")) {
                assertEquals(1, handle.query().referenceCount());
                assertEquals(1, calls.get());
                assertEquals(1, client.cache().referenceCount(KEY));
            }
        }

        @Test
        @DisplayName("unknown owner removed → count stays at zero")
        void removeUnknown_neverNegative() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));

            query.removeListener("nobody");

            assertEquals(0, query.referenceCount());
        }

        @Test
        @DisplayName("no owner given → default owner, paired by removeListener()")
        void defaultOwner() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));

            query.addListener();
            query.addListener(null);
            assertEquals(2, query.referenceCount());

            query.removeListener();
            query.removeListener(null);
            assertEquals(0, query.referenceCount());
        }

        @Test
        @DisplayName("handle closed twice → removed once")
        void handleClose_idempotent() {
            Query<String> query = client.getQuery(KEY, token -> Mono.just("milk"));
            QueryHandle<Query<String>> first = query.acquire("view-1");
            QueryHandle<Query<String>> second = query.acquire("view-1");

            first.close();
            first.close();

            assertEquals(1, query.referenceCount());
            second.close();
            assertEquals(0, query.referenceCount());
            assertFalse(query.isDisposed(), "dispose delay not yet elapsed");
        }

        @Test
        @DisplayName("last listener gone, zero delay → disposed, stream completes, cache kept")
        void lastListener_disposes() {
            QueryClient eager = newClient(Duration.ZERO, 0);
            try {
                Query<String> query = eager.getQuery(KEY, token -> Mono.just("milk"));
                QueryHandle<Query<String>> handle = query.acquire("view-1");

                StepVerifier.create(query.stream())
                    .then(handle::close)
                    .verifyComplete();

                assertTrue(query.isDisposed());
                assertFalse(eager.hasQuery(KEY));
                assertTrue(eager.cache().contains(KEY));
                assertThrows(IllegalStateException.class, () -> query.addListener("late"));
            } finally {
                eager.close();
            }
        }

        @Test
        @DisplayName("listener re-added before the delay → disposal cancelled")
        void reAcquire_cancelsDisposal() throws InterruptedException {
            QueryClient delayed = newClient(Duration.ofMillis(100), 0);
            try {
                Query<String> query = delayed.getQuery(KEY, token -> Mono.just("milk"));
                query.acquire("view-1").close();
                QueryHandle<Query<String>> again = query.acquire("view-2");

                Thread.sleep(300);

                assertFalse(query.isDisposed());
                again.close();
            } finally {
                delayed.close();
            }
        }
    }
}
