package com.queryplatform.core.query;

import java.time.Instant;

/**
 * One slot of an {@link InfiniteQuery}. A failed refetch keeps the slot's previous data next to
 * the new error.
 *
 * @param fetchedAt when {@code data} was last written, {@code null} if never
 */
public record Page<T, P>(
    P param,
    T data,
    Throwable error,
    Status status,
    Instant fetchedAt
) {

    public enum Status {
        LOADING,
        SUCCESS,
        ERROR
    }

    public static <T, P> Page<T, P> loading(P param) {
        return new Page<>(param, null, null, Status.LOADING, null);
    }

    public static <T, P> Page<T, P> success(P param, T data, Instant fetchedAt) {
        return new Page<>(param, data, null, Status.SUCCESS, fetchedAt);
    }

    public boolean hasData()   { return data != null; }
    public boolean isLoading() { return status == Status.LOADING; }
    public boolean isError()   { return status == Status.ERROR; }

    Page<T, P> toLoading() {
        return new Page<>(param, data, null, Status.LOADING, fetchedAt);
    }

    Page<T, P> toFailed(Throwable error) {
        return new Page<>(param, data, error, Status.ERROR, fetchedAt);
    }

    /** State of a page whose loading was cancelled: previous data restored, or {@code null} to drop it. */
    Page<T, P> toCancelled() {
        if (!isLoading()) {
            return this;
        }
        return hasData() ? new Page<>(param, data, null, Status.SUCCESS, fetchedAt) : null;
    }
}
