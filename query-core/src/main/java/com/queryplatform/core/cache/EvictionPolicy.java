package com.queryplatform.core.cache;

/**
 * Which entry {@link CacheStore} drops when it grows past {@link CacheConfig#maxEntries()}.
 */
public enum EvictionPolicy {

    /** Least recently used: the entry whose last read or write is oldest. */
    LRU(EvictionStrategy.LEAST_RECENTLY_USED),

    /** Least frequently used: the entry with the fewest accesses, oldest access breaking ties. */
    LFU(EvictionStrategy.LEAST_FREQUENTLY_USED),

    /** First in, first out: the entry written longest ago, regardless of reads. */
    FIFO(EvictionStrategy.FIRST_IN_FIRST_OUT);

    private final EvictionStrategy strategy;

    EvictionPolicy(EvictionStrategy strategy) {
        this.strategy = strategy;
    }

    public EvictionStrategy strategy() {
        return strategy;
    }
}
