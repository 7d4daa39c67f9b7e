package com.queryplatform.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Serialisable form of a non-secure {@link CacheEntry}. The key is the {@code ':'}-joined
 * string form; restored keys therefore have string parts.
 */
public record PersistedCacheEntry(
    String key,
    Object data,
    Instant fetchedAt,
    Duration staleTime,
    Duration cacheTime,
    Instant expiresAt
) {}
