package com.queryplatform.core.query;

import com.queryplatform.core.circuit.CircuitBreakerOptions;
import com.queryplatform.core.model.QueryKey;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings shared by {@link QueryOptions} and {@link InfiniteQueryOptions}. A {@code null}
 * duration, retry policy or breaker falls back to the client's {@link QueryClientConfig}.
 */
public interface FetchOptions {

    Duration staleTime();

    Duration cacheTime();

    RetryPolicy retryPolicy();

    /** Breaker scope; defaults to the query key's string form when a breaker is configured. */
    String circuitBreakerScope();

    CircuitBreakerOptions circuitBreakerOptions();

    boolean enabled();

    boolean secure();

    Duration maxAge();

    QueryKey parentKey();

    boolean refetchOnMount();

    /**
     * Plain-value view for error reports and logs. Never includes data, callbacks or functions.
     */
    default Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "staleTime", staleTime());
        putIfPresent(out, "cacheTime", cacheTime());
        if (retryPolicy() != null) {
            out.put("maxRetries", retryPolicy().maxRetries());
        }
        putIfPresent(out, "circuitBreakerScope", circuitBreakerScope());
        out.put("circuitBreaker", circuitBreakerOptions() != null);
        out.put("enabled", enabled());
        out.put("secure", secure());
        out.put("refetchOnMount", refetchOnMount());
        putIfPresent(out, "parentKey", parentKey() == null ? null : parentKey().asString());
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String name, Object value) {
        if (value != null) {
            out.put(name, value);
        }
    }
}
