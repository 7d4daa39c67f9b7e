package com.queryplatform.core.cache;

import java.time.Duration;
import java.util.List;

/**
 * Read-only copy of {@link CacheMetrics} handed to collaborators.
 */
public record CacheMetricsSnapshot(
    long hits,
    long misses,
    long evictions,
    int size,
    List<Duration> recentFetchDurations
) {

    public CacheMetricsSnapshot {
        recentFetchDurations = List.copyOf(recentFetchDurations);
    }

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public Duration averageFetchDuration() {
        if (recentFetchDurations.isEmpty()) {
            return Duration.ZERO;
        }
        long totalNanos = recentFetchDurations.stream().mapToLong(Duration::toNanos).sum();
        return Duration.ofNanos(totalNanos / recentFetchDurations.size());
    }
}
