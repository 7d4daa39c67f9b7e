package com.queryplatform.core.offline;

/**
 * Outcome of one {@link OfflineQueueManager#processQueue()} pass.
 *
 * @param dropped entries removed because no handler is registered for their type
 */
public record ReplayReport(int succeeded, int failed, int dropped) {

    public static final ReplayReport EMPTY = new ReplayReport(0, 0, 0);

    public int total() {
        return succeeded + failed + dropped;
    }
}
