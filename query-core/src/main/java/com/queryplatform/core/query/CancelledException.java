package com.queryplatform.core.query;

import com.queryplatform.core.error.QueryPlatformException;

/**
 * Raised when a cancelled {@link CancellationToken} is checked. Never retried and never counted
 * against a circuit breaker.
 */
public class CancelledException extends QueryPlatformException {

    public CancelledException() {
        super("Query", "operation cancelled");
    }
}
