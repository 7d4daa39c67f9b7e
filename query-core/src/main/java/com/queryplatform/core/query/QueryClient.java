package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheEntry;
import com.queryplatform.core.cache.CacheEntryOptions;
import com.queryplatform.core.cache.CacheStore;
import com.queryplatform.core.circuit.CircuitBreakerRegistry;
import com.queryplatform.core.dependency.DependencyManager;
import com.queryplatform.core.error.ErrorReporter;
import com.queryplatform.core.model.QueryKey;
import com.queryplatform.core.offline.NetworkStatus;
import com.queryplatform.core.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Entry point of the engine: owns the cache, the circuit breakers, the dependency graph and the
 * registry of live queries.
 *
 * <p><strong>One query per key:</strong> {@link #getQuery} returns the live query for a key or
 * creates it; the options and fetch function of later calls for the same key are ignored. A
 * query leaves the registry when it is disposed, which happens once its last listener is gone
 * and the dispose delay has passed. The cache entry outlives it and is collected separately.
 *
 * <p>Construct one client per process (or per signed-in user) and pass it explicitly; there is
 * no global instance.
 */
public class QueryClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryClient.class);

    private final QueryClientConfig config;
    private final CacheStore cache;
    private final CircuitBreakerRegistry breakers;
    private final DependencyManager dependencies;
    private final WorkerPool workerPool;
    private final Scheduler scheduler;
    private final Clock clock;
    private final NetworkStatus networkStatus;
    private final List<ErrorReporter> reporters = new CopyOnWriteArrayList<>();
    private final Map<QueryKey, AbstractQuery<?>> queries = new ConcurrentHashMap<>();
    private final QueryEnvironment env;

    private volatile Disposable gcCycle;
    private volatile boolean closed;

    public QueryClient() {
        this(QueryClientConfig.defaults());
    }

    public QueryClient(QueryClientConfig config) {
        this(config, Clock.systemUTC(), Schedulers.parallel(), null);
    }

    /**
     * @param scheduler     runs retry backoff, disposal timers and the cache GC cycle; must support
     *                      delayed tasks
     * @param networkStatus reported to error reporters, may be {@code null} (treated as online)
     * @throws IllegalArgumentException if {@code scheduler} cannot run delayed tasks
     */
    public QueryClient(QueryClientConfig config, Clock clock, Scheduler scheduler, NetworkStatus networkStatus) {
        this.config        = config;
        this.clock         = clock;
        this.scheduler     = requireTimeCapable(scheduler);
        this.networkStatus = networkStatus;
        this.cache         = new CacheStore(config.cache(), clock);
        this.breakers      = new CircuitBreakerRegistry(clock);
        this.dependencies  = new DependencyManager();
        this.workerPool    = config.workerPoolSize() > 0 ? new WorkerPool(config.workerPoolSize()) : null;
        this.env = new QueryEnvironment(cache, breakers, dependencies, workerPool, scheduler, clock, config,
            reporters, () -> networkStatus == null || networkStatus.isOnline(), this::onQueryDisposed);
        scheduleNextGc();
        log.info("[QueryClient] STARTED maxEntries={} eviction={} disposeDelayMs={} workers={}",
                 config.cache().maxEntries(), config.cache().evictionPolicy(),
                 config.disposeDelay().toMillis(), config.workerPoolSize());
    }

    // ── queries ─────────────────────────────────────────────────────────────

    public <T> Query<T> getQuery(QueryKey key, QueryFunction<T> fetchFunction) {
        return getQuery(key, fetchFunction, QueryOptions.defaults());
    }

    /**
     * Returns the live query for {@code key}, creating it on first use.
     *
     * @throws IllegalArgumentException if {@code options.parentKey()} would create a dependency cycle
     * @throws IllegalStateException    if {@code key} is registered as an infinite query
     */
    public <T> Query<T> getQuery(QueryKey key, QueryFunction<T> fetchFunction, QueryOptions<T> options) {
        ensureOpen();
        QueryOptions<T> effective = options != null ? options : QueryOptions.defaults();
        AbstractQuery<?> query = queries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isDisposed()) {
                return existing;
            }
            registerParent(k, effective.parentKey());
            log.debug("[QueryClient] QUERY_CREATED key={}", k);
            return new Query<>(k, fetchFunction, effective, env);
        });
        if (!(query instanceof Query)) {
            throw new IllegalStateException("Key " + key + " is registered as an infinite query");
        }
        return cast(query);
    }

    /**
     * Returns the live infinite query for {@code key}, creating it on first use.
     *
     * @throws IllegalStateException if {@code key} is registered as a plain query
     */
    public <T, P> InfiniteQuery<T, P> getInfiniteQuery(QueryKey key, PageFunction<T, P> pageFunction,
                                                       InfiniteQueryOptions<T, P> options) {
        Objects.requireNonNull(pageFunction, "pageFunction");
        Objects.requireNonNull(options, "options");
        ensureOpen();
        AbstractQuery<?> query = queries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isDisposed()) {
                return existing;
            }
            registerParent(k, options.parentKey());
            log.debug("[QueryClient] INFINITE_QUERY_CREATED key={}", k);
            return new InfiniteQuery<>(k, pageFunction, options, env);
        });
        if (!(query instanceof InfiniteQuery)) {
            throw new IllegalStateException("Key " + key + " is registered as a plain query");
        }
        return cast(query);
    }

    public boolean hasQuery(QueryKey key) {
        AbstractQuery<?> query = queries.get(key);
        return query != null && !query.isDisposed();
    }

    public int queryCount() {
        return queries.size();
    }

    public Set<QueryKey> queryKeys() {
        return Set.copyOf(queries.keySet());
    }

    // ── prefetch ────────────────────────────────────────────────────────────

    public <T> Mono<QueryState<T>> prefetchQuery(QueryKey key, QueryFunction<T> fetchFunction) {
        return prefetchQuery(key, fetchFunction, QueryOptions.defaults());
    }

    /**
     * Fetches {@code key} into the cache unless a fresh entry is already there. A query created
     * only for the prefetch is disposed after the dispose delay, leaving the cache entry behind.
     */
    public <T> Mono<QueryState<T>> prefetchQuery(QueryKey key, QueryFunction<T> fetchFunction,
                                                 QueryOptions<T> options) {
        return Mono.defer(() -> {
            Query<T> query = getQuery(key, fetchFunction, options);
            return query.fetch().doFinally(signal -> query.scheduleDisposalIfUnused());
        });
    }

    /**
     * Prefetches all {@code configs} in parallel. A failing prefetch is logged and does not
     * affect the others.
     */
    public Mono<Void> prefetchQueries(List<PrefetchConfig<?>> configs) {
        return Flux.fromIterable(configs)
            .flatMap(this::prefetchTolerant)
            .then();
    }

    private <T> Mono<Void> prefetchTolerant(PrefetchConfig<T> config) {
        return prefetchQuery(config.key(), config.fetchFunction(), config.options())
            .onErrorResume(e -> {
                log.warn("[QueryClient] PREFETCH_FAILED key={} error={}", config.key(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    // ── invalidation ────────────────────────────────────────────────────────

    /**
     * Marks {@code key} and all its dependents stale. Queries among them with listeners refetch
     * right away; the others refetch on their next use.
     */
    public void invalidateQuery(QueryKey key) {
        List<QueryKey> targets = new ArrayList<>();
        targets.add(key);
        targets.addAll(dependencies.getAllDescendants(key));
        targets.forEach(cache::invalidate);
        refetchActive(targets);
        log.debug("[QueryClient] INVALIDATED key={} dependents={}", key, targets.size() - 1);
    }

    public void invalidateQueriesWithPrefix(QueryKey prefix) {
        invalidateQueriesWhere(k -> k.startsWith(prefix));
    }

    public void invalidateQueriesWhere(Predicate<QueryKey> predicate) {
        List<QueryKey> targets = new ArrayList<>(cache.invalidateWhere(predicate));
        for (QueryKey key : queries.keySet()) {
            if (predicate.test(key) && !targets.contains(key)) {
                targets.add(key);
            }
        }
        refetchActive(targets);
    }

    private void refetchActive(List<QueryKey> keys) {
        for (QueryKey key : keys) {
            AbstractQuery<?> query = queries.get(key);
            if (query == null || query.referenceCount() == 0) {
                continue;
            }
            if (query instanceof Query) {
                ((Query<?>) query).fetch(true);
            } else if (query instanceof InfiniteQuery) {
                ((InfiniteQuery<?, ?>) query).refetchAll().subscribe(
                    s -> { },
                    e -> log.warn("[QueryClient] REFETCH_FAILED key={} error={}", key, e.getMessage()));
            }
        }
    }

    // ── direct cache access ─────────────────────────────────────────────────

    /**
     * Writes {@code data} to the cache and, if a query for {@code key} is live, to its state.
     */
    public <T> void setQueryData(QueryKey key, T data) {
        AbstractQuery<?> query = queries.get(key);
        if (query instanceof Query) {
            Query<T> typed = cast(query);
            cache.set(key, data, typed.entryOptions());
            typed.updateFromCache(data);
        } else {
            cache.set(key, data, CacheEntryOptions.defaults());
        }
    }

    /**
     * @return the cached value, or {@code null} if absent or expired
     * @throws com.queryplatform.core.cache.CacheTypeMismatchException if the value is not a {@code type}
     */
    public <T> T getQueryData(QueryKey key, Class<T> type) {
        CacheEntry<T> entry = cache.get(key, type);
        return entry == null ? null : entry.data();
    }

    public Object getQueryData(QueryKey key) {
        CacheEntry<?> entry = cache.get(key);
        return entry == null ? null : entry.data();
    }

    // ── removal ─────────────────────────────────────────────────────────────

    /** Disposes the query for {@code key}, if any, and drops its cache entry. */
    public void removeQuery(QueryKey key) {
        AbstractQuery<?> query = queries.remove(key);
        if (query != null) {
            query.dispose();
        }
        cache.remove(key);
    }

    /** Like {@link #removeQuery}, but only if {@code key} is registered as an infinite query. */
    public boolean removeInfiniteQuery(QueryKey key) {
        AbstractQuery<?> query = queries.get(key);
        if (!(query instanceof InfiniteQuery)) {
            return false;
        }
        removeQuery(key);
        return true;
    }

    /** Disposes every query and empties the cache, breakers and dependency graph. */
    public void clear() {
        List<AbstractQuery<?>> live = new ArrayList<>(queries.values());
        queries.clear();
        live.forEach(AbstractQuery::dispose);
        cache.clear();
        breakers.clearAll();
        dependencies.clear();
        log.info("[QueryClient] CLEARED queries={}", live.size());
    }

    // ── error reporting ─────────────────────────────────────────────────────

    public void addErrorReporter(ErrorReporter reporter) {
        reporters.add(reporter);
    }

    public void removeErrorReporter(ErrorReporter reporter) {
        reporters.remove(reporter);
    }

    // ── collaborators ───────────────────────────────────────────────────────

    public CacheStore cache() {
        return cache;
    }

    public CircuitBreakerRegistry circuitBreakers() {
        return breakers;
    }

    public DependencyManager dependencies() {
        return dependencies;
    }

    /** {@code null} when the client was configured without workers. */
    public WorkerPool workerPool() {
        return workerPool;
    }

    public QueryClientConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    // ── lifecycle ───────────────────────────────────────────────────────────

    /** Clears everything, stops the GC cycle and the worker pool. The client is unusable afterwards. */
    public void dispose() {
        if (closed) {
            return;
        }
        closed = true;
        Disposable cycle = gcCycle;
        if (cycle != null) {
            cycle.dispose();
        }
        clear();
        if (workerPool != null) {
            workerPool.close();
        }
        log.info("[QueryClient] DISPOSED");
    }

    @Override
    public void close() {
        dispose();
    }

    public boolean isClosed() {
        return closed;
    }

    // ── internals ───────────────────────────────────────────────────────────

    private void registerParent(QueryKey child, QueryKey parent) {
        if (parent != null) {
            dependencies.registerDependency(child, parent);
        }
    }

    /**
     * Drops a disposed query from the registry, cancels its direct dependents and removes it
     * from the graph.
     */
    private void onQueryDisposed(AbstractQuery<?> query) {
        QueryKey key = query.key();
        boolean removed = queries.remove(key, query);
        if (!removed && queries.containsKey(key)) {
            // a replacement query already owns the key and its graph edges
            return;
        }
        dependencies.notifyParentDisposed(key, child -> {
            AbstractQuery<?> dependent = queries.get(child);
            if (dependent != null) {
                dependent.cancel();
            }
        });
        dependencies.unregister(key);
    }

    /**
     * One GC sweep after {@code gcInterval}; each sweep schedules the next, so a failing sweep
     * never stops the cycle.
     */
    private void scheduleNextGc() {
        if (closed) {
            return;
        }
        gcCycle = Mono.delay(config.cache().gcInterval(), scheduler)
            .subscribe(
                tick -> {
                    try {
                        cache.garbageCollect();
                    } catch (RuntimeException e) {
                        log.warn("[QueryClient] GC_FAILED error={}", e.getMessage(), e);
                    }
                    scheduleNextGc();
                },
                err -> log.warn("[QueryClient] GC_SCHEDULING_FAILED error={}", err.getMessage()));
    }

    private static Scheduler requireTimeCapable(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        try {
            scheduler.schedule(() -> { }, 1, TimeUnit.DAYS).dispose();
        } catch (RejectedExecutionException e) {
            throw new IllegalArgumentException("Scheduler cannot run delayed tasks: " + scheduler, e);
        }
        return scheduler;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("QueryClient is disposed");
        }
    }

    @SuppressWarnings("unchecked")
    private static <Q> Q cast(AbstractQuery<?> query) {
        return (Q) query;
    }
}
