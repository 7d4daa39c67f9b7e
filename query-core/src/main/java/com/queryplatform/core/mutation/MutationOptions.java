package com.queryplatform.core.mutation;

import com.queryplatform.core.model.QueryKey;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * @param mutationType     offline queue type, also the replay handler name
 * @param key              query key recorded on queued entries
 * @param queueWhenOffline enqueue instead of running while the network is down
 * @param invalidates      query keys invalidated after a successful run
 */
public record MutationOptions<R>(
    String mutationType,
    QueryKey key,
    boolean queueWhenOffline,
    List<QueryKey> invalidates,
    Consumer<R> onSuccess,
    Consumer<Throwable> onError
) {

    public MutationOptions {
        Objects.requireNonNull(mutationType, "mutationType");
        invalidates = invalidates == null ? List.of() : List.copyOf(invalidates);
    }

    public static <R> MutationOptions<R> of(String mutationType, QueryKey key) {
        return new MutationOptions<>(mutationType, key, false, List.of(), null, null);
    }

    public MutationOptions<R> withQueueWhenOffline(boolean queueWhenOffline) {
        return new MutationOptions<>(mutationType, key, queueWhenOffline, invalidates, onSuccess, onError);
    }

    public MutationOptions<R> withInvalidates(List<QueryKey> invalidates) {
        return new MutationOptions<>(mutationType, key, queueWhenOffline, invalidates, onSuccess, onError);
    }

    public MutationOptions<R> withOnSuccess(Consumer<R> onSuccess) {
        return new MutationOptions<>(mutationType, key, queueWhenOffline, invalidates, onSuccess, onError);
    }

    public MutationOptions<R> withOnError(Consumer<Throwable> onError) {
        return new MutationOptions<>(mutationType, key, queueWhenOffline, invalidates, onSuccess, onError);
    }
}
