package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheEntry;
import com.queryplatform.core.model.QueryKey;
import com.queryplatform.core.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State machine for one cacheable fetch, created and owned by {@link QueryClient}.
 *
 * <p><strong>Fetch:</strong> {@link #fetch()} answers from the cache while the entry is fresh,
 * otherwise joins the in-flight attempt or starts one. A started attempt moves the state to
 * {@code LOADING} (prior data stays visible), then to {@code SUCCESS} with the cache written, or
 * to {@code ERROR} once retries are exhausted. Ordinary fetch errors are stored in state and the
 * returned {@code Mono} completes normally with the error state; only an open circuit is
 * signalled as an error.
 */
public class Query<T> extends AbstractQuery<QueryState<T>> {

    private static final Logger log = LoggerFactory.getLogger(Query.class);

    private final QueryFunction<T> fetchFunction;
    private final QueryOptions<T> options;

    Query(QueryKey key, QueryFunction<T> fetchFunction, QueryOptions<T> options, QueryEnvironment env) {
        super(key, options, env);
        this.fetchFunction = Objects.requireNonNull(fetchFunction, "fetchFunction");
        this.options       = options;
        this.state         = initialState();
    }

    public QueryOptions<T> options() {
        return options;
    }

    public T data() {
        return state().data();
    }

    /** Whether the cached value is missing or stale right now. */
    public boolean isStale() {
        return isCacheStale();
    }

    public Mono<QueryState<T>> fetch() {
        return fetch(false);
    }

    /**
     * @param forceRefetch bypass the fresh-cache check and supersede any in-flight attempt
     */
    public Mono<QueryState<T>> fetch(boolean forceRefetch) {
        return execute(new Fetch<T>(forceRefetch) {

            @Override
            Mono<QueryState<T>> shortCircuit() {
                if (forceRefetch) {
                    return null;
                }
                Optional<CacheEntry<?>> fresh = freshEntry();
                if (fresh.isEmpty()) {
                    return null;
                }
                CacheEntry<?> entry = fresh.get();
                if (!Objects.equals(entry.fetchedAt(), state.dataUpdatedAt())) {
                    emit(QueryState.success(cast(entry.data()), entry.fetchedAt(), false));
                }
                log.debug("[Query] SERVED_FROM_CACHE key={}", key);
                return Mono.just(state);
            }

            @Override
            QueryState<T> loading(QueryState<T> current) {
                return current.toLoading();
            }

            @Override
            Mono<T> call(CancellationToken token) {
                return fetchFunction.fetch(token);
            }

            @Override
            Mono<Optional<T>> afterFetch(Optional<T> result) {
                if (options.transformer() == null || result.isEmpty()) {
                    return Mono.just(result);
                }
                return transform(result.get()).map(Optional::of);
            }

            @Override
            QueryState<T> commit(QueryState<T> current, T data) {
                CacheEntry<T> entry = env.cache().set(key, data, entryOptions());
                return QueryState.success(data, entry.fetchedAt(), entry.isStale(env.clock().instant()));
            }

            @Override
            QueryState<T> fail(QueryState<T> current, Throwable error) {
                return current.toError(error);
            }

            @Override
            void onSuccess(T data) {
                if (options.onSuccess() != null) {
                    options.onSuccess().accept(data);
                }
            }

            @Override
            void onError(Throwable error) {
                if (options.onError() != null) {
                    options.onError().accept(error);
                }
            }
        });
    }

    /**
     * Writes {@code data} to state and cache without calling the fetch function, e.g. for an
     * optimistic update. An in-flight attempt keeps running and may overwrite it.
     */
    public void setData(T data) {
        synchronized (lock) {
            CacheEntry<T> entry = env.cache().set(key, data, entryOptions());
            emit(QueryState.success(data, entry.fetchedAt(), entry.isStale(env.clock().instant()))
                .withFetching(inFlight != null));
        }
    }

    /**
     * Writes {@code data} to state only; used when the cache entry was already written.
     */
    public void updateFromCache(T data) {
        synchronized (lock) {
            Instant updatedAt = env.cache().inspect(key)
                .map(CacheEntry::fetchedAt)
                .orElseGet(() -> env.clock().instant());
            emit(QueryState.success(data, updatedAt, isCacheStale()).withFetching(inFlight != null));
        }
    }

    public QueryHandle<Query<T>> acquire(String ownerId) {
        addListener(ownerId);
        return new QueryHandle<>(this, ownerId);
    }

    @Override
    void onFirstListener() {
        QueryState<T> current = state();
        if (options.refetchOnMount()) {
            fetch(true);
        } else if (current.isIdle() || !current.hasData() || isCacheStale()) {
            fetch(false);
        }
    }

    @Override
    QueryState<T> cancelledState(QueryState<T> current) {
        return current.toCancelled();
    }

    // ── internals ───────────────────────────────────────────────────────────

    private QueryState<T> initialState() {
        return env.cache().inspect(key)
            .filter(entry -> !entry.isExpired(env.clock().instant()) && entry.dataType() != null)
            .map(entry -> QueryState.success(this.<T>cast(entry.data()), entry.fetchedAt(),
                entry.isStale(env.clock().instant())))
            .orElseGet(QueryState::idle);
    }

    /** A fresh entry for this key, counted as a cache access. */
    private Optional<CacheEntry<?>> freshEntry() {
        CacheEntry<?> entry = env.cache().get(key);
        if (entry == null || !entry.isFresh(env.clock().instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private Mono<T> transform(T data) {
        WorkerPool pool = env.workerPool();
        Mono<T> transformed = pool != null
            ? pool.execute(options.transformer(), data)
            : Mono.fromCallable(() -> options.transformer().apply(data));
        return transformed
            .defaultIfEmpty(data)
            .onErrorResume(e -> {
                log.warn("[Query] TRANSFORM_FAILED key={} error={}: keeping untransformed data",
                         key, e.getMessage());
                return Mono.just(data);
            });
    }

    // The client guarantees one query per key, so the cached value under this key was written
    // by this query or by setQueryData for the same key.
    @SuppressWarnings("unchecked")
    private <V> V cast(Object value) {
        return (V) value;
    }
}
