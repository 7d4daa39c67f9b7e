package com.queryplatform.core.query;

import reactor.core.publisher.Mono;

/**
 * Fetches the page identified by {@code param}.
 */
@FunctionalInterface
public interface PageFunction<T, P> {

    Mono<T> fetchPage(P param, CancellationToken token);
}
