package com.queryplatform.core.cache;

import com.queryplatform.core.model.QueryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bounded, in-memory store of {@link CacheEntry} values keyed by {@link QueryKey}.
 *
 * <p><strong>Eviction:</strong> every {@link #set} that pushes the store past
 * {@link CacheConfig#maxEntries()} drops entries chosen by the configured
 * {@link EvictionPolicy} until it is back within capacity. Entries retained by a live query
 * ({@link #retain}) and the entry being written are never chosen.
 *
 * <p><strong>Expiry:</strong> {@link #get} on an entry past its {@code expiresAt} removes it and
 * reports a miss. {@link #garbageCollect()} additionally sweeps unreferenced entries whose
 * {@code cacheTime} elapsed since their last access.
 *
 * <p>All mutating operations are serialised on the store's monitor; lookups update access
 * bookkeeping and are therefore mutating too. Values of secure entries never reach the log.
 */
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final CacheConfig config;
    private final Clock clock;
    private final EvictionStrategy evictionStrategy;
    private final Map<QueryKey, CacheEntry<?>> entries = new LinkedHashMap<>();
    private final Map<QueryKey, Integer> references = new HashMap<>();
    private final CacheMetrics metrics;

    private long insertionCounter;
    private long accessCounter;

    public CacheStore() {
        this(CacheConfig.defaults(), Clock.systemUTC());
    }

    public CacheStore(CacheConfig config, Clock clock) {
        this.config           = config;
        this.clock            = clock;
        this.evictionStrategy = config.evictionPolicy().strategy();
        this.metrics          = new CacheMetrics(this::size);
    }

    // ── lookups ─────────────────────────────────────────────────────────────

    /**
     * Returns the live entry for {@code key}, or {@code null} if absent or expired.
     * A hit counts as an access for LRU/LFU purposes.
     */
    public synchronized CacheEntry<?> get(QueryKey key) {
        CacheEntry<?> entry = entries.get(key);
        if (entry == null) {
            metrics.recordMiss();
            log.debug("CACHE_MISS key={}", key);
            return null;
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            entries.remove(key);
            metrics.recordMiss();
            metrics.recordEviction();
            log.debug("CACHE_EXPIRED key={} expiresAt={}", key, entry.expiresAt());
            return null;
        }
        CacheEntry<?> touched = entry.withAccess(now, ++accessCounter);
        entries.put(key, touched);
        metrics.recordHit();
        log.debug("CACHE_HIT key={} ageMs={}", key, touched.age(now).toMillis());
        return touched;
    }

    /**
     * Typed lookup.
     *
     * @throws CacheTypeMismatchException if the held value is not an instance of {@code type}
     */
    public <T> CacheEntry<T> get(QueryKey key, Class<T> type) {
        CacheEntry<?> entry = get(key);
        if (entry == null) {
            return null;
        }
        if (entry.data() != null && !type.isInstance(entry.data())) {
            throw new CacheTypeMismatchException(key, type, entry.data().getClass());
        }
        return entry.as(type);
    }

    /**
     * Returns the entry without touching access bookkeeping, metrics or expiry.
     */
    public synchronized Optional<CacheEntry<?>> inspect(QueryKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized boolean contains(QueryKey key) {
        return entries.containsKey(key);
    }

    public synchronized Set<QueryKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    public synchronized int size() {
        return entries.size();
    }

    // ── writes ──────────────────────────────────────────────────────────────

    public <T> CacheEntry<T> set(QueryKey key, T data) {
        return set(key, data, CacheEntryOptions.defaults());
    }

    /**
     * Writes {@code data} under {@code key}, replacing any previous entry, then evicts down to
     * capacity.
     */
    public synchronized <T> CacheEntry<T> set(QueryKey key, T data, CacheEntryOptions options) {
        Instant now = clock.instant();
        Duration staleTime = options.staleTime() != null ? options.staleTime() : config.defaultStaleTime();
        Duration cacheTime = options.cacheTime() != null ? options.cacheTime() : config.defaultCacheTime();
        Instant expiresAt  = options.maxAge() != null ? now.plus(options.maxAge()) : null;

        CacheEntry<T> entry = new CacheEntry<>(data, null, now, staleTime, cacheTime, options.secure(),
            expiresAt, now, 1, ++insertionCounter, ++accessCounter);
        entries.remove(key);
        entries.put(key, entry);
        if (options.secure()) {
            log.debug("CACHE_SET key={} secure=true expiresAt={}", key, expiresAt);
        } else {
            log.debug("CACHE_SET key={} staleTimeMs={}", key, staleTime.toMillis());
        }
        evictOverflow(key);
        return entry;
    }

    /**
     * Attaches a fetch error to an existing entry, keeping its data. No-op when absent.
     */
    public synchronized void recordError(QueryKey key, Throwable error) {
        entries.computeIfPresent(key, (k, e) -> e.withError(error));
    }

    public synchronized boolean remove(QueryKey key) {
        boolean removed = entries.remove(key) != null;
        if (removed) {
            log.debug("CACHE_REMOVE key={}", key);
        }
        return removed;
    }

    public synchronized void clear() {
        int count = entries.size();
        entries.clear();
        metrics.reset();
        log.info("CACHE_CLEAR removed={}", count);
    }

    /**
     * Drops every secure entry. Called on sign-out or shutdown.
     */
    public synchronized int clearSecureEntries() {
        int removed = removeIf(e -> e.getValue().secure());
        log.info("CACHE_CLEAR_SECURE removed={}", removed);
        return removed;
    }

    // ── invalidation ────────────────────────────────────────────────────────

    /**
     * Marks the entry stale so the next fetch goes to the source; the data stays readable.
     */
    public synchronized boolean invalidate(QueryKey key) {
        CacheEntry<?> updated = entries.computeIfPresent(key, (k, e) -> e.invalidated());
        return updated != null;
    }

    public synchronized List<QueryKey> invalidateWithPrefix(QueryKey prefix) {
        return invalidateWhere(k -> k.startsWith(prefix));
    }

    public synchronized List<QueryKey> invalidateWhere(Predicate<QueryKey> predicate) {
        List<QueryKey> invalidated = new ArrayList<>();
        entries.replaceAll((k, e) -> {
            if (predicate.test(k)) {
                invalidated.add(k);
                return e.invalidated();
            }
            return e;
        });
        log.debug("CACHE_INVALIDATE count={}", invalidated.size());
        return invalidated;
    }

    // ── references ──────────────────────────────────────────────────────────

    /**
     * Pins {@code key} against eviction and garbage collection. Counts nest; the pin survives
     * rewrites of the entry and may be taken before the entry exists.
     */
    public synchronized void retain(QueryKey key) {
        references.merge(key, 1, Integer::sum);
    }

    public synchronized void release(QueryKey key) {
        references.computeIfPresent(key, (k, n) -> n <= 1 ? null : n - 1);
    }

    public synchronized int referenceCount(QueryKey key) {
        return references.getOrDefault(key, 0);
    }

    // ── maintenance ─────────────────────────────────────────────────────────

    /**
     * Removes unreferenced entries that outlived their {@code cacheTime} and secure entries
     * past expiry.
     *
     * @return number of entries removed
     */
    public synchronized int garbageCollect() {
        Instant now = clock.instant();
        int removed = removeIf(e -> !references.containsKey(e.getKey()) && e.getValue().isCollectable(now));
        if (removed > 0) {
            log.debug("CACHE_GC removed={} remaining={}", removed, entries.size());
        }
        return removed;
    }

    /**
     * Hands every non-secure, unexpired entry to {@code persister}. Persister failures are
     * logged and swallowed; the in-memory state is unaffected.
     */
    public void saveTo(CachePersister persister) {
        List<PersistedCacheEntry> snapshot = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            entries.forEach((k, e) -> {
                if (!e.secure() && !e.isExpired(now)) {
                    snapshot.add(new PersistedCacheEntry(k.asString(), e.data(), e.fetchedAt(),
                        e.staleTime(), e.cacheTime(), e.expiresAt()));
                }
            });
        }
        try {
            persister.save(snapshot);
            log.info("CACHE_PERSIST saved={}", snapshot.size());
        } catch (RuntimeException e) {
            log.warn("CACHE_PERSIST failed entries={}: {}", snapshot.size(), e.getMessage(), e);
        }
    }

    /**
     * Loads previously persisted entries, skipping those already expired. Restored entries keep
     * their original {@code fetchedAt}, so freshness is judged against the original fetch.
     *
     * @return number of entries restored
     */
    public int restoreFrom(CachePersister persister) {
        List<PersistedCacheEntry> loaded;
        try {
            loaded = persister.load();
        } catch (RuntimeException e) {
            log.warn("CACHE_RESTORE failed: {}", e.getMessage(), e);
            return 0;
        }
        int restored = 0;
        synchronized (this) {
            Instant now = clock.instant();
            for (PersistedCacheEntry p : loaded) {
                if (p.expiresAt() != null && now.isAfter(p.expiresAt())) {
                    continue;
                }
                Duration staleTime = p.staleTime() != null ? p.staleTime() : config.defaultStaleTime();
                Duration cacheTime = p.cacheTime() != null ? p.cacheTime() : config.defaultCacheTime();
                entries.put(QueryKey.parse(p.key()), new CacheEntry<>(p.data(), null, p.fetchedAt(),
                    staleTime, cacheTime, false, p.expiresAt(), now, 0, ++insertionCounter, ++accessCounter));
                restored++;
            }
            evictOverflow(null);
        }
        log.info("CACHE_RESTORE restored={} skipped={}", restored, loaded.size() - restored);
        return restored;
    }

    public CacheMetrics metrics() {
        return metrics;
    }

    public CacheConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    // ── internals ───────────────────────────────────────────────────────────

    private void evictOverflow(QueryKey protectedKey) {
        while (entries.size() > config.maxEntries()) {
            Optional<QueryKey> victim = evictionStrategy.selectVictim(entries,
                k -> !k.equals(protectedKey) && !references.containsKey(k));
            if (victim.isEmpty()) {
                log.warn("CACHE_OVER_CAPACITY size={} maxEntries={} reason=all_entries_referenced",
                         entries.size(), config.maxEntries());
                return;
            }
            entries.remove(victim.get());
            metrics.recordEviction();
            log.debug("CACHE_EVICT key={} policy={}", victim.get(), config.evictionPolicy());
        }
    }

    private int removeIf(Predicate<Map.Entry<QueryKey, CacheEntry<?>>> predicate) {
        int before = entries.size();
        entries.entrySet().removeIf(predicate);
        return before - entries.size();
    }
}
