package com.queryplatform.core.offline;

import java.util.List;

/**
 * Durable backing of {@link OfflineQueueManager}. Both calls may block; the manager runs them on
 * its I/O scheduler. {@code save} receives the complete queue each time.
 */
public interface OfflineQueueStore {

    void save(List<OfflineMutationEntry> entries);

    List<OfflineMutationEntry> load();
}
