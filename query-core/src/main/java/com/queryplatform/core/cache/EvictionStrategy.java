package com.queryplatform.core.cache;

import com.queryplatform.core.model.QueryKey;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Chooses the next entry to drop from an over-capacity {@link CacheStore}.
 *
 * <p>Ordering uses the store's logical counters ({@link CacheEntry#accessSequence()},
 * {@link CacheEntry#insertionOrder()}) rather than wall-clock timestamps, so two accesses
 * within the same clock tick are still ordered.
 */
@FunctionalInterface
public interface EvictionStrategy {

    EvictionStrategy LEAST_RECENTLY_USED = byOrder(
        Comparator.<CacheEntry<?>>comparingLong(CacheEntry::accessSequence));

    EvictionStrategy LEAST_FREQUENTLY_USED = byOrder(
        Comparator.<CacheEntry<?>>comparingLong(CacheEntry::accessCount)
            .thenComparingLong(CacheEntry::accessSequence));

    EvictionStrategy FIRST_IN_FIRST_OUT = byOrder(
        Comparator.<CacheEntry<?>>comparingLong(CacheEntry::insertionOrder));

    /**
     * @param entries   current store contents
     * @param evictable entries that may be dropped (unreferenced, not the entry being written)
     * @return the key to evict, or empty if nothing is evictable
     */
    Optional<QueryKey> selectVictim(Map<QueryKey, CacheEntry<?>> entries, Predicate<QueryKey> evictable);

    static EvictionStrategy byOrder(Comparator<CacheEntry<?>> order) {
        return (entries, evictable) -> entries.entrySet().stream()
            .filter(e -> evictable.test(e.getKey()))
            .min(Map.Entry.<QueryKey, CacheEntry<?>>comparingByValue(order))
            .map(Map.Entry::getKey);
    }
}
