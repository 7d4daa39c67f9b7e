package com.queryplatform.core.query;

import com.queryplatform.core.circuit.CircuitBreakerOptions;
import com.queryplatform.core.model.QueryKey;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Per-query settings. Start from {@link #defaults()} and refine with the withers:
 *
 * <pre>{@code
 * QueryOptions.<User>defaults()
 *     .withStaleTime(Duration.ofSeconds(30))
 *     .withRetryPolicy(RetryPolicy.none())
 *     .withCircuitBreaker(CircuitBreakerOptions.defaults());
 * }</pre>
 *
 * @param transformer optional post-processing of fetched data, run on the client's worker pool
 */
public record QueryOptions<T>(
    Duration staleTime,
    Duration cacheTime,
    RetryPolicy retryPolicy,
    String circuitBreakerScope,
    CircuitBreakerOptions circuitBreakerOptions,
    boolean enabled,
    boolean secure,
    Duration maxAge,
    QueryKey parentKey,
    boolean refetchOnMount,
    Consumer<T> onSuccess,
    Consumer<Throwable> onError,
    UnaryOperator<T> transformer
) implements FetchOptions {

    public static <T> QueryOptions<T> defaults() {
        return new QueryOptions<>(null, null, null, null, null, true, false, null, null, false,
            null, null, null);
    }

    public QueryOptions<T> withStaleTime(Duration staleTime) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withCacheTime(Duration cacheTime) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withRetryPolicy(RetryPolicy retryPolicy) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withCircuitBreaker(CircuitBreakerOptions circuitBreakerOptions) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withCircuitBreaker(String scope, CircuitBreakerOptions circuitBreakerOptions) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, scope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withEnabled(boolean enabled) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    /** Marks the cached value secure with a hard TTL of {@code maxAge}. */
    public QueryOptions<T> withSecure(Duration maxAge) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, true, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withMaxAge(Duration maxAge) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withParentKey(QueryKey parentKey) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withRefetchOnMount(boolean refetchOnMount) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withOnSuccess(Consumer<T> onSuccess) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withOnError(Consumer<Throwable> onError) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }

    public QueryOptions<T> withTransformer(UnaryOperator<T> transformer) {
        return new QueryOptions<>(staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions,
            enabled, secure, maxAge, parentKey, refetchOnMount, onSuccess, onError, transformer);
    }
}
