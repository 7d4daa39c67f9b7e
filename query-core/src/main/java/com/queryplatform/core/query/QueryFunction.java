package com.queryplatform.core.query;

import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;

/**
 * Caller-supplied fetch. The returned {@code Mono} is subscribed once per attempt, so it should
 * be lazy; an empty {@code Mono} yields a successful fetch with {@code null} data.
 */
@FunctionalInterface
public interface QueryFunction<T> {

    Mono<T> fetch(CancellationToken token);

    /** Adapts a blocking call; runs on the subscribing thread. */
    static <T> QueryFunction<T> fromCallable(Callable<T> callable) {
        return token -> Mono.fromCallable(() -> {
            token.throwIfCancelled();
            return callable.call();
        });
    }
}
