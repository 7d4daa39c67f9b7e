package com.queryplatform.core.query;

import com.queryplatform.core.model.QueryKey;

/**
 * One entry of {@link QueryClient#prefetchQueries}.
 */
public record PrefetchConfig<T>(QueryKey key, QueryFunction<T> fetchFunction, QueryOptions<T> options) {

    public static <T> PrefetchConfig<T> of(QueryKey key, QueryFunction<T> fetchFunction) {
        return new PrefetchConfig<>(key, fetchFunction, QueryOptions.defaults());
    }
}
