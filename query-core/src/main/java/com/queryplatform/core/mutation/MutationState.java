package com.queryplatform.core.mutation;

import java.util.UUID;

/**
 * @param queuedEntryId id of the offline queue entry when {@code status} is {@code QUEUED}
 */
public record MutationState<R>(
    MutationStatus status,
    R data,
    Throwable error,
    UUID queuedEntryId
) {

    public static <R> MutationState<R> idle() {
        return new MutationState<>(MutationStatus.IDLE, null, null, null);
    }

    static <R> MutationState<R> loading() {
        return new MutationState<>(MutationStatus.LOADING, null, null, null);
    }

    static <R> MutationState<R> success(R data) {
        return new MutationState<>(MutationStatus.SUCCESS, data, null, null);
    }

    static <R> MutationState<R> failed(Throwable error) {
        return new MutationState<>(MutationStatus.ERROR, null, error, null);
    }

    static <R> MutationState<R> queued(UUID entryId) {
        return new MutationState<>(MutationStatus.QUEUED, null, null, entryId);
    }

    public boolean isSuccess() { return status == MutationStatus.SUCCESS; }
    public boolean isError()   { return status == MutationStatus.ERROR; }
    public boolean isQueued()  { return status == MutationStatus.QUEUED; }
}
