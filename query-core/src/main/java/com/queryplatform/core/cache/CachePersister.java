package com.queryplatform.core.cache;

import java.util.List;

/**
 * Storage backend for cache snapshots. The codec and medium are the implementation's concern;
 * {@link CacheStore} never hands it secure entries.
 */
public interface CachePersister {

    void save(List<PersistedCacheEntry> entries);

    List<PersistedCacheEntry> load();
}
