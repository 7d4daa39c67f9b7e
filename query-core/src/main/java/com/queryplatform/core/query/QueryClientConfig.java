package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheConfig;
import com.queryplatform.core.circuit.CircuitBreakerOptions;

import java.time.Duration;

/**
 * Client-wide defaults.
 *
 * @param disposeDelay          how long a query with no listeners stays registered; zero disposes at once
 * @param defaultRetryPolicy    used by queries that do not set their own
 * @param defaultCircuitBreaker breaker applied to queries without their own, {@code null} for none
 * @param workerPoolSize        threads for data transformers; zero disables the pool
 */
public record QueryClientConfig(
    CacheConfig cache,
    Duration disposeDelay,
    RetryPolicy defaultRetryPolicy,
    CircuitBreakerOptions defaultCircuitBreaker,
    int workerPoolSize
) {

    public QueryClientConfig {
        if (cache == null) {
            cache = CacheConfig.defaults();
        }
        if (disposeDelay == null) {
            disposeDelay = Duration.ofSeconds(5);
        }
        if (disposeDelay.isNegative()) {
            throw new IllegalArgumentException("disposeDelay must not be negative: " + disposeDelay);
        }
        if (defaultRetryPolicy == null) {
            defaultRetryPolicy = RetryPolicy.defaults();
        }
        if (workerPoolSize < 0) {
            throw new IllegalArgumentException("workerPoolSize must be >= 0: " + workerPoolSize);
        }
    }

    public static QueryClientConfig defaults() {
        return new QueryClientConfig(CacheConfig.defaults(), Duration.ofSeconds(5), RetryPolicy.defaults(), null, 2);
    }

    public QueryClientConfig withCache(CacheConfig cache) {
        return new QueryClientConfig(cache, disposeDelay, defaultRetryPolicy, defaultCircuitBreaker, workerPoolSize);
    }

    public QueryClientConfig withDisposeDelay(Duration disposeDelay) {
        return new QueryClientConfig(cache, disposeDelay, defaultRetryPolicy, defaultCircuitBreaker, workerPoolSize);
    }

    public QueryClientConfig withDefaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
        return new QueryClientConfig(cache, disposeDelay, defaultRetryPolicy, defaultCircuitBreaker, workerPoolSize);
    }

    public QueryClientConfig withDefaultCircuitBreaker(CircuitBreakerOptions defaultCircuitBreaker) {
        return new QueryClientConfig(cache, disposeDelay, defaultRetryPolicy, defaultCircuitBreaker, workerPoolSize);
    }

    public QueryClientConfig withWorkerPoolSize(int workerPoolSize) {
        return new QueryClientConfig(cache, disposeDelay, defaultRetryPolicy, defaultCircuitBreaker, workerPoolSize);
    }
}
