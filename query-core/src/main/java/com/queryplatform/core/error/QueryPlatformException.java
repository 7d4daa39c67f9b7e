package com.queryplatform.core.error;

/**
 * Root of every exception raised by the query engine itself.
 *
 * <p>Errors thrown by caller-supplied fetch or mutation functions are never wrapped in
 * this type; they are stored in state as-is.
 */
public class QueryPlatformException extends RuntimeException {
    private final String component;

    public QueryPlatformException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public QueryPlatformException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
