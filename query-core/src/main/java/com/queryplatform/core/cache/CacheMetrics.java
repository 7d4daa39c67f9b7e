package com.queryplatform.core.cache;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Counters owned by a {@link CacheStore}. Fetch durations are kept in a bounded window of the
 * most recent {@value #FETCH_SAMPLE_LIMIT} samples.
 */
public class CacheMetrics {

    static final int FETCH_SAMPLE_LIMIT = 100;

    private final AtomicLong hits      = new AtomicLong();
    private final AtomicLong misses    = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final Deque<Duration> fetchDurations = new ArrayDeque<>();
    private final IntSupplier sizeSupplier;

    CacheMetrics(IntSupplier sizeSupplier) {
        this.sizeSupplier = sizeSupplier;
    }

    void recordHit()      { hits.incrementAndGet(); }
    void recordMiss()     { misses.incrementAndGet(); }
    void recordEviction() { evictions.incrementAndGet(); }

    /** Records how long one fetch for this store took; called by queries on success. */
    public void recordFetchDuration(Duration duration) {
        synchronized (fetchDurations) {
            fetchDurations.addLast(duration);
            while (fetchDurations.size() > FETCH_SAMPLE_LIMIT) {
                fetchDurations.removeFirst();
            }
        }
    }

    public long hits()      { return hits.get(); }
    public long misses()    { return misses.get(); }
    public long evictions() { return evictions.get(); }

    public CacheMetricsSnapshot snapshot() {
        List<Duration> samples;
        synchronized (fetchDurations) {
            samples = new ArrayList<>(fetchDurations);
        }
        return new CacheMetricsSnapshot(hits.get(), misses.get(), evictions.get(),
            sizeSupplier.getAsInt(), samples);
    }

    void reset() {
        hits.set(0);
        misses.set(0);
        evictions.set(0);
        synchronized (fetchDurations) {
            fetchDurations.clear();
        }
    }
}
