package com.queryplatform.core.query;

import java.time.Instant;

/**
 * Immutable snapshot of a {@link Query}. Every transition produces a new instance and one event
 * on {@link Query#stream()}.
 *
 * @param fetching      an attempt is in flight; prior {@code data} stays visible meanwhile
 * @param dataUpdatedAt when {@code data} was last written, {@code null} if never
 * @param stale         whether {@code data} was stale at the time of the snapshot
 */
public record QueryState<T>(
    QueryStatus status,
    T data,
    Throwable error,
    boolean fetching,
    Instant dataUpdatedAt,
    boolean stale
) {

    public static <T> QueryState<T> idle() {
        return new QueryState<>(QueryStatus.IDLE, null, null, false, null, true);
    }

    public static <T> QueryState<T> success(T data, Instant updatedAt, boolean stale) {
        return new QueryState<>(QueryStatus.SUCCESS, data, null, false, updatedAt, stale);
    }

    public boolean hasData()    { return dataUpdatedAt != null; }
    public boolean hasError()   { return error != null; }
    public boolean isIdle()     { return status == QueryStatus.IDLE; }
    public boolean isLoading()  { return status == QueryStatus.LOADING; }
    public boolean isSuccess()  { return status == QueryStatus.SUCCESS; }
    public boolean isError()    { return status == QueryStatus.ERROR; }

    QueryState<T> toLoading() {
        return new QueryState<>(QueryStatus.LOADING, data, error, true, dataUpdatedAt, stale);
    }

    QueryState<T> toError(Throwable error) {
        return new QueryState<>(QueryStatus.ERROR, data, error, false, dataUpdatedAt, stale);
    }

    /** Outcome of cancelling an attempt: back to the last committed data, or idle. */
    QueryState<T> toCancelled() {
        return hasData()
            ? new QueryState<>(QueryStatus.SUCCESS, data, null, false, dataUpdatedAt, stale)
            : idle();
    }

    /** Keeps {@code LOADING} visible when data is written while an attempt is still running. */
    QueryState<T> withFetching(boolean fetching) {
        return fetching ? toLoading() : this;
    }
}
