package com.queryplatform.core.offline;

import java.util.List;

/**
 * Non-durable store for tests and for hosts that do not need the queue to survive a restart.
 */
public class InMemoryOfflineQueueStore implements OfflineQueueStore {

    private volatile List<OfflineMutationEntry> saved = List.of();

    @Override
    public void save(List<OfflineMutationEntry> entries) {
        saved = List.copyOf(entries);
    }

    @Override
    public List<OfflineMutationEntry> load() {
        return saved;
    }
}
