package com.queryplatform.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One immutable cache slot. {@link CacheStore} replaces the whole record on every write or
 * access, so a reference handed out by {@code get} is a consistent snapshot.
 *
 * <p><strong>Freshness:</strong> an entry is fresh while {@code now < fetchedAt + staleTime}
 * and not expired. It is expired once {@code expiresAt} (set from {@code maxAge}) has passed;
 * an expired entry is therefore always stale and is never served.
 *
 * @param data            cached value, may be {@code null} when only an error was recorded
 * @param error           last fetch error recorded against this key, {@code null} if none
 * @param fetchedAt       when {@code data} was written
 * @param staleTime       freshness window
 * @param cacheTime       retention after last access once no query holds the entry
 * @param secure          excluded from persistence and from logs
 * @param expiresAt       hard expiry, {@code null} for none
 * @param lastAccessedAt  wall-clock time of the last read or write
 * @param accessCount     reads and writes since insertion
 * @param insertionOrder  store-wide write sequence, drives FIFO
 * @param accessSequence  store-wide access sequence, drives LRU
 */
public record CacheEntry<T>(
    T data,
    Throwable error,
    Instant fetchedAt,
    Duration staleTime,
    Duration cacheTime,
    boolean secure,
    Instant expiresAt,
    Instant lastAccessedAt,
    long accessCount,
    long insertionOrder,
    long accessSequence
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isFresh(Instant now) {
        return !isExpired(now) && now.isBefore(fetchedAt.plus(staleTime));
    }

    public boolean isStale(Instant now) {
        return !isFresh(now);
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /** Runtime type of {@code data}, or {@code null} when no data is held. */
    public Class<?> dataType() {
        return data == null ? null : data.getClass();
    }

    /**
     * Eligible for garbage collection: secure entries past their expiry, otherwise entries not
     * accessed within {@code cacheTime}.
     */
    public boolean isCollectable(Instant now) {
        if (secure && expiresAt != null) {
            return now.isAfter(expiresAt);
        }
        return isExpired(now) || now.isAfter(lastAccessedAt.plus(cacheTime));
    }

    /**
     * Re-types this entry after checking {@code type} against the held value.
     *
     * @throws ClassCastException if the data is not an instance of {@code type}
     */
    public <R> CacheEntry<R> as(Class<R> type) {
        return new CacheEntry<>(type.cast(data), error, fetchedAt, staleTime, cacheTime, secure,
            expiresAt, lastAccessedAt, accessCount, insertionOrder, accessSequence);
    }

    CacheEntry<T> withAccess(Instant now, long sequence) {
        return new CacheEntry<>(data, error, fetchedAt, staleTime, cacheTime, secure,
            expiresAt, now, accessCount + 1, insertionOrder, sequence);
    }

    CacheEntry<T> withError(Throwable error) {
        return new CacheEntry<>(data, error, fetchedAt, staleTime, cacheTime, secure,
            expiresAt, lastAccessedAt, accessCount, insertionOrder, accessSequence);
    }

    /** Marks the entry stale without touching its data or access bookkeeping. */
    CacheEntry<T> invalidated() {
        return new CacheEntry<>(data, error, fetchedAt, Duration.ZERO, cacheTime, secure,
            expiresAt, lastAccessedAt, accessCount, insertionOrder, accessSequence);
    }
}
