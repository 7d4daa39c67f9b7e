package com.queryplatform.core.worker;

import com.queryplatform.core.error.QueryPlatformException;

/**
 * A task submitted to {@link WorkerPool} threw, or could not be scheduled.
 */
public class WorkerExecutionException extends QueryPlatformException {

    public WorkerExecutionException(String message, Throwable cause) {
        super("WorkerPool", message, cause);
    }
}
