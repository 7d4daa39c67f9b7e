package com.queryplatform.core.cache;

import java.time.Duration;

/**
 * Per-write settings for {@link CacheStore#set}. A {@code null} duration falls back to the
 * store's {@link CacheConfig} default.
 *
 * @param staleTime how long the data counts as fresh after the write
 * @param cacheTime how long an unreferenced entry survives garbage collection after its last access
 * @param secure    excluded from persistence and logging, cleared by {@link CacheStore#clearSecureEntries()}
 * @param maxAge    hard TTL; the entry is expired (never served) once {@code fetchedAt + maxAge} passes
 */
public record CacheEntryOptions(
    Duration staleTime,
    Duration cacheTime,
    boolean secure,
    Duration maxAge
) {

    public CacheEntryOptions {
        requireNonNegative(staleTime, "staleTime");
        requireNonNegative(cacheTime, "cacheTime");
        requireNonNegative(maxAge, "maxAge");
    }

    public static CacheEntryOptions defaults() {
        return new CacheEntryOptions(null, null, false, null);
    }

    public static CacheEntryOptions secure(Duration maxAge) {
        return new CacheEntryOptions(null, null, true, maxAge);
    }

    public CacheEntryOptions withStaleTime(Duration staleTime) {
        return new CacheEntryOptions(staleTime, cacheTime, secure, maxAge);
    }

    public CacheEntryOptions withCacheTime(Duration cacheTime) {
        return new CacheEntryOptions(staleTime, cacheTime, secure, maxAge);
    }

    public CacheEntryOptions withMaxAge(Duration maxAge) {
        return new CacheEntryOptions(staleTime, cacheTime, secure, maxAge);
    }

    private static void requireNonNegative(Duration d, String name) {
        if (d != null && d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + d);
        }
    }
}
