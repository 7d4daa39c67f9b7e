package com.queryplatform.core.query;

import com.queryplatform.core.model.QueryKey;

import java.time.Duration;
import java.util.List;

/**
 * Read-only counters of one query.
 *
 * @param fetchCount           fetch-function invocations, retries included
 * @param recentFetchDurations durations of the most recent successful attempts
 */
public record QueryMetrics(
    QueryKey key,
    int referenceCount,
    int fetchCount,
    int retryCount,
    List<Duration> recentFetchDurations
) {

    public QueryMetrics {
        recentFetchDurations = List.copyOf(recentFetchDurations);
    }
}
