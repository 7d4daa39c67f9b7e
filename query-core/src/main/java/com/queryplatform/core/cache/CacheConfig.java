package com.queryplatform.core.cache;

import java.time.Duration;

/**
 * Store-wide limits and defaults.
 *
 * @param maxEntries       capacity; every {@code set} beyond it evicts per {@code evictionPolicy}
 * @param evictionPolicy   LRU, LFU or FIFO
 * @param defaultStaleTime freshness window for writes that do not specify one (zero: always stale)
 * @param defaultCacheTime retention of unreferenced entries for writes that do not specify one
 * @param gcInterval       period of the owning client's garbage-collection sweep
 */
public record CacheConfig(
    int maxEntries,
    EvictionPolicy evictionPolicy,
    Duration defaultStaleTime,
    Duration defaultCacheTime,
    Duration gcInterval
) {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (evictionPolicy == null) {
            evictionPolicy = EvictionPolicy.LRU;
        }
        if (defaultStaleTime == null) {
            defaultStaleTime = Duration.ZERO;
        }
        if (defaultCacheTime == null) {
            defaultCacheTime = Duration.ofMinutes(5);
        }
        if (gcInterval == null) {
            gcInterval = Duration.ofSeconds(30);
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_ENTRIES, EvictionPolicy.LRU, null, null, null);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(maxEntries, evictionPolicy, defaultStaleTime, defaultCacheTime, gcInterval);
    }

    public CacheConfig withEvictionPolicy(EvictionPolicy evictionPolicy) {
        return new CacheConfig(maxEntries, evictionPolicy, defaultStaleTime, defaultCacheTime, gcInterval);
    }

    public CacheConfig withDefaultStaleTime(Duration defaultStaleTime) {
        return new CacheConfig(maxEntries, evictionPolicy, defaultStaleTime, defaultCacheTime, gcInterval);
    }

    public CacheConfig withDefaultCacheTime(Duration defaultCacheTime) {
        return new CacheConfig(maxEntries, evictionPolicy, defaultStaleTime, defaultCacheTime, gcInterval);
    }

    public CacheConfig withGcInterval(Duration gcInterval) {
        return new CacheConfig(maxEntries, evictionPolicy, defaultStaleTime, defaultCacheTime, gcInterval);
    }
}
