package com.queryplatform.core.query;

import com.queryplatform.core.circuit.CircuitBreakerOptions;
import com.queryplatform.core.model.QueryKey;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Settings of an {@link InfiniteQuery}.
 *
 * <p>The page-parameter functions receive the current page list and the data of the last (or
 * first) page that holds data, {@code null} if none; returning {@code null} means there is no
 * further page in that direction. They are called while the query holds its lock and must be
 * pure.
 *
 * @param initialPageParam     parameter of the first page; when {@code null} the first page
 *                             parameter is {@code getNextPageParam(emptyList, null)}
 * @param getPreviousPageParam {@code null} disables backwards paging
 * @param maxPages             upper bound on held pages, zero for unbounded
 */
public record InfiniteQueryOptions<T, P>(
    P initialPageParam,
    BiFunction<List<Page<T, P>>, T, P> getNextPageParam,
    BiFunction<List<Page<T, P>>, T, P> getPreviousPageParam,
    int maxPages,
    Duration staleTime,
    Duration cacheTime,
    RetryPolicy retryPolicy,
    String circuitBreakerScope,
    CircuitBreakerOptions circuitBreakerOptions,
    boolean enabled,
    boolean secure,
    Duration maxAge,
    QueryKey parentKey,
    boolean refetchOnMount
) implements FetchOptions {

    public InfiniteQueryOptions {
        Objects.requireNonNull(getNextPageParam, "getNextPageParam");
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0: " + maxPages);
        }
    }

    public static <T, P> InfiniteQueryOptions<T, P> of(BiFunction<List<Page<T, P>>, T, P> getNextPageParam) {
        return new InfiniteQueryOptions<>(null, getNextPageParam, null, 0, null, null, null, null, null,
            true, false, null, null, false);
    }

    public InfiniteQueryOptions<T, P> withInitialPageParam(P initialPageParam) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withPreviousPageParam(BiFunction<List<Page<T, P>>, T, P> getPreviousPageParam) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withMaxPages(int maxPages) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withStaleTime(Duration staleTime) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withRetryPolicy(RetryPolicy retryPolicy) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withCircuitBreaker(CircuitBreakerOptions circuitBreakerOptions) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withEnabled(boolean enabled) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withParentKey(QueryKey parentKey) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }

    public InfiniteQueryOptions<T, P> withRefetchOnMount(boolean refetchOnMount) {
        return new InfiniteQueryOptions<>(initialPageParam, getNextPageParam, getPreviousPageParam, maxPages,
            staleTime, cacheTime, retryPolicy, circuitBreakerScope, circuitBreakerOptions, enabled, secure,
            maxAge, parentKey, refetchOnMount);
    }
}
