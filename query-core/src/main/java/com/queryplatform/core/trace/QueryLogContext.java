package com.queryplatform.core.trace;

import org.slf4j.MDC;

/**
 * Bridges the query key into MDC for the duration of a single log statement.
 *
 * <p>Query state machines hop between caller threads, Reactor scheduler threads and
 * whatever thread a fetch function completes on, so MDC is never used as a persistent
 * ThreadLocal store. It is populated around the log call and removed right after.
 *
 * <pre>
 *     QueryLogContext.withMdc(key.asString(), () -&gt; log.info("[Query] fetch started. key={}", key));
 * </pre>
 */
public final class QueryLogContext {

    public static final String QUERY_KEY = "queryKey";

    private QueryLogContext() {}

    /**
     * Runs {@code logAction} with {@code queryKey} present in MDC, restoring whatever value
     * was there before.
     *
     * @param queryKey  string form of the key being logged about
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String queryKey, Runnable logAction) {
        String previous = MDC.get(QUERY_KEY);
        MDC.put(QUERY_KEY, queryKey);
        try {
            logAction.run();
        } finally {
            if (previous != null) {
                MDC.put(QUERY_KEY, previous);
            } else {
                MDC.remove(QUERY_KEY);
            }
        }
    }
}
