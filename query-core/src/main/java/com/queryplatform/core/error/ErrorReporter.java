package com.queryplatform.core.error;

/**
 * Sink for fetch failures, e.g. a crash reporter. Implementations must not assume they are
 * the only reporter; an exception thrown here is logged and does not reach the query.
 */
@FunctionalInterface
public interface ErrorReporter {
    void report(ErrorContext context);
}
