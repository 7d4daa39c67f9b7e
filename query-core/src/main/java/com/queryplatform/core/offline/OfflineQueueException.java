package com.queryplatform.core.offline;

import com.queryplatform.core.error.QueryPlatformException;

/**
 * The offline queue could not be read from or written to its store.
 */
public class OfflineQueueException extends QueryPlatformException {

    public OfflineQueueException(String message, Throwable cause) {
        super("OfflineQueue", message, cause);
    }
}
