package com.queryplatform.core.error;

import com.queryplatform.core.model.QueryKey;

import java.time.Duration;
import java.util.Map;

/**
 * What an {@link ErrorReporter} receives for one failed fetch, after retries were exhausted.
 *
 * @param options sanitised view of the query options: plain values only, never data or callbacks
 */
public record ErrorContext(
    QueryKey key,
    int retryCount,
    Duration staleTime,
    boolean online,
    Throwable error,
    Map<String, Object> options
) {

    public ErrorContext {
        options = options == null ? Map.of() : Map.copyOf(options);
    }
}
