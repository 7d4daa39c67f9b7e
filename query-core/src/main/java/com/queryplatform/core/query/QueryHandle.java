package com.queryplatform.core.query;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One listener registration on a query. Closing it removes the listener exactly once, so
 * try-with-resources or an owning component's teardown can release the query safely.
 */
public final class QueryHandle<Q extends AbstractQuery<?>> implements AutoCloseable {

    private final Q query;
    private final String ownerId;
    private final AtomicBoolean closed = new AtomicBoolean();

    QueryHandle(Q query, String ownerId) {
        this.query   = query;
        this.ownerId = ownerId;
    }

    public Q query() {
        return query;
    }

    public String ownerId() {
        return ownerId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            query.removeListener(ownerId);
        }
    }
}
