package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheEntryOptions;
import com.queryplatform.core.circuit.CircuitBreaker;
import com.queryplatform.core.circuit.CircuitBreakerOpenException;
import com.queryplatform.core.circuit.CircuitBreakerOptions;
import com.queryplatform.core.circuit.CircuitPermit;
import com.queryplatform.core.error.ErrorContext;
import com.queryplatform.core.error.ErrorReporter;
import com.queryplatform.core.model.QueryKey;
import com.queryplatform.core.trace.QueryLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle shared by {@link Query} and {@link InfiniteQuery}: listener reference counting,
 * delayed disposal, the state stream, and the fetch pipeline (deduplication, circuit breaker,
 * retry with backoff, cancellation).
 *
 * <p><strong>Attempts:</strong> at most one attempt is in flight. A plain fetch joins it; a
 * forced fetch cancels its token and hands its caller over to the replacement. Only the current
 * attempt may commit, so a superseded attempt that completes anyway is discarded.
 *
 * <p><strong>Threading:</strong> fetch functions may complete on any thread. Every transition
 * happens under the query's monitor, and state events are emitted under it too so subscribers
 * see them in order. Fetch functions, transformers, callbacks and error reporters are always
 * invoked outside it. Stream subscribers must not block.
 *
 * @param <S> state snapshot type published on {@link #stream()}
 */
public abstract class AbstractQuery<S> {

    private static final Logger log = LoggerFactory.getLogger(AbstractQuery.class);

    private static final int DURATION_SAMPLES = 20;

    /** Owner used when a listener is registered without one. */
    public static final String DEFAULT_OWNER = "default";

    final QueryKey key;
    final FetchOptions fetchOptions;
    final QueryEnvironment env;
    final Object lock = new Object();

    private final Map<String, Integer> listeners = new HashMap<>();
    // subscribers read through their own unbounded buffer (see stream()), so nothing is dropped here
    private final Sinks.Many<S> states = Sinks.many().multicast().directBestEffort();
    private final Deque<Duration> fetchDurations = new ArrayDeque<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    // ── guarded by lock ─────────────────────────────────────────────────────
    S state;
    Attempt inFlight;
    int retryCount;
    private int referenceCount;
    private boolean retainsCacheEntry;
    private boolean disposed;
    private Disposable disposeTimer;

    AbstractQuery(QueryKey key, FetchOptions fetchOptions, QueryEnvironment env) {
        this.key          = Objects.requireNonNull(key, "key");
        this.fetchOptions = Objects.requireNonNull(fetchOptions, "fetchOptions");
        this.env          = Objects.requireNonNull(env, "env");
    }

    /** Fetch started by the first listener, if the query needs one. */
    abstract void onFirstListener();

    /** State after the in-flight attempt was cancelled. */
    abstract S cancelledState(S current);

    // ── accessors ───────────────────────────────────────────────────────────

    public QueryKey key() {
        return key;
    }

    public S state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Hot stream of state transitions, one event per transition, completed on dispose. Late
     * subscribers see only subsequent transitions; read {@link #state()} for the current one.
     * Each subscriber is buffered independently, so one that requests slowly still receives
     * every transition.
     */
    public Flux<S> stream() {
        return states.asFlux().onBackpressureBuffer();
    }

    public boolean isFetching() {
        synchronized (lock) {
            return inFlight != null;
        }
    }

    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    public int referenceCount() {
        synchronized (lock) {
            return referenceCount;
        }
    }

    public QueryMetrics metrics() {
        int refs;
        int retries;
        synchronized (lock) {
            refs    = referenceCount;
            retries = retryCount;
        }
        synchronized (fetchDurations) {
            return new QueryMetrics(key, refs, fetchCount.get(), retries, new ArrayList<>(fetchDurations));
        }
    }

    // ── listeners and disposal ──────────────────────────────────────────────

    /** {@link #addListener(String)} under {@link #DEFAULT_OWNER}. */
    public void addListener() {
        addListener(DEFAULT_OWNER);
    }

    /**
     * Registers one listener for {@code ownerId} ({@code null} means {@link #DEFAULT_OWNER}).
     * Registrations nest; each needs its own {@link #removeListener}. The first listener cancels
     * a pending disposal and may trigger a fetch.
     *
     * @throws IllegalStateException if the query was already disposed
     */
    public void addListener(String ownerId) {
        ownerId = ownerId != null ? ownerId : DEFAULT_OWNER;
        boolean first;
        synchronized (lock) {
            if (disposed) {
                throw new IllegalStateException("Query " + key + " is disposed");
            }
            listeners.merge(ownerId, 1, Integer::sum);
            referenceCount++;
            cancelDisposeTimer();
            first = referenceCount == 1;
            if (first && !retainsCacheEntry) {
                env.cache().retain(key);
                retainsCacheEntry = true;
            }
        }
        log.debug("[Query] LISTENER_ADDED key={} owner={}", key, ownerId);
        if (first) {
            onFirstListener();
        }
    }

    /** {@link #removeListener(String)} under {@link #DEFAULT_OWNER}. */
    public void removeListener() {
        removeListener(DEFAULT_OWNER);
    }

    /**
     * Removes one registration of {@code ownerId}; unknown owners are ignored, so the count
     * never goes negative. Dropping to zero arms the disposal timer.
     */
    public void removeListener(String ownerId) {
        ownerId = ownerId != null ? ownerId : DEFAULT_OWNER;
        boolean last;
        synchronized (lock) {
            Integer count = listeners.get(ownerId);
            if (count == null) {
                log.debug("[Query] LISTENER_UNKNOWN key={} owner={}", key, ownerId);
                return;
            }
            if (count == 1) {
                listeners.remove(ownerId);
            } else {
                listeners.put(ownerId, count - 1);
            }
            referenceCount--;
            last = referenceCount == 0;
            if (last) {
                releaseCacheEntry();
            }
        }
        log.debug("[Query] LISTENER_REMOVED key={} owner={}", key, ownerId);
        if (last) {
            scheduleDisposal();
        }
    }

    /** Arms the disposal timer for a query nobody listens to, e.g. after a prefetch. */
    void scheduleDisposalIfUnused() {
        synchronized (lock) {
            if (disposed || referenceCount > 0 || disposeTimer != null) {
                return;
            }
        }
        scheduleDisposal();
    }

    /**
     * Cancels the in-flight attempt, if any, without disposing. Its caller receives the
     * resulting state: the last committed data, or idle.
     */
    public void cancel() {
        Attempt attempt;
        S snapshot;
        synchronized (lock) {
            attempt = inFlight;
            if (attempt == null) {
                return;
            }
            inFlight = null;
            releaseProbe(attempt);
            snapshot = cancelledState(state);
            emit(snapshot);
        }
        attempt.cancel();
        attempt.complete(snapshot);
        log.debug("[Query] CANCELLED key={}", key);
    }

    /**
     * Cancels in-flight work, completes the state stream and detaches the query from its client.
     * Idempotent.
     */
    public void dispose() {
        Attempt attempt;
        S snapshot;
        synchronized (lock) {
            if (disposed) {
                return;
            }
            attempt = inFlight;
            inFlight = null;
            if (attempt != null) {
                releaseProbe(attempt);
                emit(cancelledState(state));
            }
            disposed = true;
            snapshot = state;
            cancelDisposeTimer();
            releaseCacheEntry();
            listeners.clear();
            referenceCount = 0;
            states.tryEmitComplete();
        }
        if (attempt != null) {
            attempt.cancel();
            attempt.complete(snapshot);
        }
        QueryLogContext.withMdc(key.asString(), () -> log.debug("[Query] DISPOSED key={}", key));
        env.onDisposed().accept(this);
    }

    // ── fetch pipeline ──────────────────────────────────────────────────────

    /**
     * One kind of fetch (whole query, next page, previous page, ...). Methods documented as
     * running under the lock must not call user code.
     */
    abstract class Fetch<R> {

        final boolean supersede;

        Fetch(boolean supersede) {
            this.supersede = supersede;
        }

        /** Under the lock. A non-null result answers the caller without starting an attempt. */
        Mono<S> shortCircuit() {
            return null;
        }

        /** Under the lock. State published when the attempt starts. */
        abstract S loading(S current);

        abstract Mono<R> call(CancellationToken token);

        /** Runs once after retries succeed, before committing. */
        Mono<Optional<R>> afterFetch(Optional<R> result) {
            return Mono.just(result);
        }

        /** Under the lock. State committed on success; {@code result} may be {@code null}. */
        abstract S commit(S current, R result);

        /** Under the lock. State committed when the attempt failed or was refused. */
        abstract S fail(S current, Throwable error);

        void onSuccess(R result) {
        }

        void onError(Throwable error) {
        }
    }

    /**
     * Starts {@code fetch}, or joins the in-flight attempt when {@code fetch} does not supersede.
     * The returned {@code Mono} is already running; it emits the committed state, or errors
     * with {@link CircuitBreakerOpenException} when the breaker refuses.
     */
    <R> Mono<S> execute(Fetch<R> fetch) {
        Attempt attempt = null;
        Attempt superseded;
        CircuitBreakerOpenException refused = null;
        synchronized (lock) {
            if (disposed || !fetchOptions.enabled()) {
                return Mono.just(state);
            }
            if (inFlight != null && !fetch.supersede) {
                return inFlight.result();
            }
            Mono<S> shortcut = fetch.shortCircuit();
            if (shortcut != null) {
                return shortcut;
            }
            superseded = inFlight;
            inFlight = null;
            if (superseded != null) {
                releaseProbe(superseded);
            }
            CircuitBreaker breaker = resolveBreaker();
            CircuitPermit permit = breaker != null ? breaker.tryAcquirePermission() : null;
            if (permit != null && !permit.isGranted()) {
                refused = new CircuitBreakerOpenException(breaker.scope());
                emit(fetch.fail(state, refused));
            } else {
                attempt = new Attempt(breaker, permit);
                inFlight = attempt;
                emit(fetch.loading(state));
            }
        }
        if (superseded != null) {
            superseded.cancel();
        }
        if (refused != null) {
            CircuitBreakerOpenException error = refused;
            QueryLogContext.withMdc(key.asString(),
                () -> log.warn("[Query] CIRCUIT_REFUSED key={} scope={}", key, error.getCircuitScope()));
            if (superseded != null) {
                superseded.result.tryEmitError(error);
            }
            return Mono.error(error);
        }
        if (superseded != null) {
            superseded.handOver(attempt);
        }
        Attempt current = attempt;
        log.debug("[Query] FETCH_STARTED key={} superseded={}", key, superseded != null);
        current.subscription(pipeline(current, fetch).subscribe(
            result -> succeed(current, fetch, result.orElse(null)),
            error -> fail(current, fetch, error)));
        return current.result();
    }

    private <R> Mono<Optional<R>> pipeline(Attempt attempt, Fetch<R> fetch) {
        RetryPolicy policy = retryPolicy();
        AtomicBoolean firstCall = new AtomicBoolean(true);
        return Mono.defer(() -> {
                attempt.token.throwIfCancelled();
                if (!firstCall.getAndSet(false) && attempt.breaker != null) {
                    CircuitPermit permit = attempt.breaker.tryAcquirePermission();
                    if (!permit.isGranted()) {
                        return Mono.<Optional<R>>error(new CircuitBreakerOpenException(attempt.breaker.scope()));
                    }
                    attempt.permit = permit;
                }
                fetchCount.incrementAndGet();
                long startedNanos = System.nanoTime();
                return Mono.defer(() -> fetch.call(attempt.token))
                    .singleOptional()
                    .doOnNext(r -> recordDuration(Duration.ofNanos(System.nanoTime() - startedNanos)))
                    .doOnError(e -> attemptFailed(attempt, e));
            })
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                Throwable failure = signal.failure();
                long retryNumber = signal.totalRetries() + 1;
                if (!RetryPolicy.isRetryable(failure)
                        || retryNumber > policy.maxRetries()
                        || attempt.token.isCancelled()) {
                    return Mono.<Long>error(failure);
                }
                Duration delay = policy.delayFor(retryNumber);
                log.debug("[Query] RETRY_SCHEDULED key={} retry={}/{} delayMs={}",
                          key, retryNumber, policy.maxRetries(), delay.toMillis());
                return delay.isZero() ? Mono.just(retryNumber) : Mono.delay(delay, env.scheduler());
            })))
            .flatMap(fetch::afterFetch);
    }

    private void attemptFailed(Attempt attempt, Throwable error) {
        if (error instanceof CancelledException || attempt.token.isCancelled()) {
            return;
        }
        if (attempt.breaker != null && !(error instanceof CircuitBreakerOpenException)) {
            attempt.breaker.recordFailure(attempt.permit, error);
        }
        synchronized (lock) {
            if (attempt == inFlight) {
                retryCount++;
            }
        }
        log.debug("[Query] ATTEMPT_FAILED key={} error={}", key, error.toString());
    }

    private <R> void succeed(Attempt attempt, Fetch<R> fetch, R result) {
        S committed;
        synchronized (lock) {
            if (!isCurrent(attempt)) {
                log.debug("[Query] RESULT_DISCARDED key={}", key);
                return;
            }
            inFlight   = null;
            retryCount = 0;
            committed  = fetch.commit(state, result);
            emit(committed);
        }
        if (attempt.breaker != null) {
            attempt.breaker.recordSuccess(attempt.permit);
        }
        log.debug("[Query] FETCH_SUCCEEDED key={}", key);
        runCallback("onSuccess", () -> fetch.onSuccess(result));
        attempt.complete(committed);
    }

    private <R> void fail(Attempt attempt, Fetch<R> fetch, Throwable error) {
        if (attempt.token.isCancelled()) {
            // cancel() or a newer attempt has already answered this attempt's caller
            return;
        }
        S committed;
        int retries;
        boolean cancelled = error instanceof CancelledException;
        synchronized (lock) {
            if (!isCurrent(attempt)) {
                return;
            }
            inFlight = null;
            if (cancelled) {
                releaseProbe(attempt);
                committed = cancelledState(state);
            } else {
                committed = fetch.fail(state, error);
            }
            emit(committed);
            retries = retryCount;
        }
        if (cancelled) {
            attempt.complete(committed);
            return;
        }
        if (error instanceof CircuitBreakerOpenException) {
            QueryLogContext.withMdc(key.asString(),
                () -> log.warn("[Query] CIRCUIT_REFUSED_RETRY key={} error={}", key, error.getMessage()));
            attempt.result.tryEmitError(error);
            return;
        }
        env.cache().recordError(key, error);
        QueryLogContext.withMdc(key.asString(),
            () -> log.warn("[Query] FETCH_FAILED key={} retries={} error={}", key, retries, error.toString()));
        report(error, retries);
        runCallback("onError", () -> fetch.onError(error));
        attempt.complete(committed);
    }

    private boolean isCurrent(Attempt attempt) {
        return attempt == inFlight && !attempt.token.isCancelled() && !disposed;
    }

    // ── helpers for subclasses ──────────────────────────────────────────────

    /** Must hold the lock. */
    void emit(S next) {
        state = next;
        states.tryEmitNext(next);
    }

    CircuitBreaker resolveBreaker() {
        CircuitBreakerOptions options = fetchOptions.circuitBreakerOptions() != null
            ? fetchOptions.circuitBreakerOptions()
            : env.config().defaultCircuitBreaker();
        if (options == null) {
            return null;
        }
        String scope = fetchOptions.circuitBreakerScope() != null
            ? fetchOptions.circuitBreakerScope()
            : key.asString();
        return env.breakers().getOrCreate(scope, options);
    }

    RetryPolicy retryPolicy() {
        return fetchOptions.retryPolicy() != null ? fetchOptions.retryPolicy() : env.config().defaultRetryPolicy();
    }

    Duration staleTime() {
        return fetchOptions.staleTime() != null ? fetchOptions.staleTime() : env.cache().config().defaultStaleTime();
    }

    CacheEntryOptions entryOptions() {
        return new CacheEntryOptions(fetchOptions.staleTime(), fetchOptions.cacheTime(),
            fetchOptions.secure(), fetchOptions.maxAge());
    }

    /** Whether the cached value for this key is missing or stale. Does not count as an access. */
    boolean isCacheStale() {
        return env.cache().inspect(key)
            .map(entry -> entry.isStale(env.clock().instant()))
            .orElse(true);
    }

    void runCallback(String name, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("[Query] CALLBACK_FAILED key={} callback={}: {}", key, name, e.getMessage(), e);
        }
    }

    private void report(Throwable error, int retries) {
        if (env.reporters().isEmpty()) {
            return;
        }
        ErrorContext context = new ErrorContext(key, retries, staleTime(), env.online().getAsBoolean(),
            error, fetchOptions.describe());
        for (ErrorReporter reporter : env.reporters()) {
            try {
                reporter.report(context);
            } catch (RuntimeException e) {
                log.warn("[Query] ERROR_REPORTER_FAILED key={} reporter={}: {}",
                         key, reporter.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void recordDuration(Duration duration) {
        synchronized (fetchDurations) {
            fetchDurations.addLast(duration);
            while (fetchDurations.size() > DURATION_SAMPLES) {
                fetchDurations.removeFirst();
            }
        }
        env.cache().metrics().recordFetchDuration(duration);
    }

    private void scheduleDisposal() {
        Duration delay = env.config().disposeDelay();
        if (delay.isZero()) {
            disposeIfUnused();
            return;
        }
        Disposable timer = Mono.delay(delay, env.scheduler()).subscribe(
            tick -> disposeIfUnused(),
            error -> {
                log.warn("[Query] DISPOSE_TIMER_FAILED key={} error={}, disposing now", key, error.toString());
                disposeIfUnused();
            });
        synchronized (lock) {
            if (disposed || referenceCount > 0) {
                timer.dispose();
                return;
            }
            if (disposeTimer != null) {
                disposeTimer.dispose();
            }
            disposeTimer = timer;
        }
        log.debug("[Query] DISPOSE_SCHEDULED key={} delayMs={}", key, delay.toMillis());
    }

    private void disposeIfUnused() {
        synchronized (lock) {
            if (disposed || referenceCount > 0) {
                return;
            }
            disposeTimer = null;
        }
        dispose();
    }

    /** Must hold the lock. */
    private void cancelDisposeTimer() {
        if (disposeTimer != null) {
            disposeTimer.dispose();
            disposeTimer = null;
        }
    }

    /** Must hold the lock. */
    private void releaseCacheEntry() {
        if (retainsCacheEntry) {
            env.cache().release(key);
            retainsCacheEntry = false;
        }
    }

    /** Must hold the lock. Frees the half-open slot if this abandoned attempt holds it. */
    private void releaseProbe(Attempt attempt) {
        if (attempt.breaker != null) {
            attempt.breaker.releasePermission(attempt.permit);
        }
    }

    // ── attempt ─────────────────────────────────────────────────────────────

    final class Attempt {
        final CancellationToken token = new CancellationToken();
        final Sinks.One<S> result = Sinks.one();
        final CircuitBreaker breaker;
        /** Permit of the latest call; each retry acquires its own. */
        volatile CircuitPermit permit;
        private volatile Disposable subscription;

        Attempt(CircuitBreaker breaker, CircuitPermit permit) {
            this.breaker = breaker;
            this.permit  = permit;
        }

        Mono<S> result() {
            return result.asMono();
        }

        void subscription(Disposable subscription) {
            this.subscription = subscription;
            if (token.isCancelled()) {
                subscription.dispose();
            }
        }

        void cancel() {
            token.cancel();
            Disposable current = subscription;
            if (current != null) {
                current.dispose();
            }
        }

        void complete(S snapshot) {
            result.tryEmitValue(snapshot);
        }

        /** Answers this attempt's caller with whatever {@code next} commits. */
        void handOver(Attempt next) {
            next.result().subscribe(this::complete, result::tryEmitError);
        }
    }
}
