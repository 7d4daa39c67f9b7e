package com.queryplatform.core.query;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Snapshot of an {@link InfiniteQuery}.
 *
 * @param error     error of the most recent failed page fetch, cleared by the next success
 * @param direction which fetch is in flight, {@code null} when idle
 */
public record InfiniteQueryState<T, P>(
    QueryStatus status,
    List<Page<T, P>> pages,
    Throwable error,
    boolean fetching,
    Direction direction,
    boolean hasNextPage,
    boolean hasPreviousPage,
    Instant dataUpdatedAt
) {

    public enum Direction {
        NEXT,
        PREVIOUS,
        REFETCH
    }

    public InfiniteQueryState {
        pages = List.copyOf(pages);
    }

    public static <T, P> InfiniteQueryState<T, P> idle(boolean hasNextPage) {
        return new InfiniteQueryState<>(QueryStatus.IDLE, List.of(), null, false, null, hasNextPage, false, null);
    }

    public int pageCount() {
        return pages.size();
    }

    /** Data of every page that holds data, in page order. */
    public List<T> pageData() {
        return pages.stream().filter(Page::hasData).map(Page::data).collect(Collectors.toList());
    }

    public boolean isFetchingNextPage()     { return direction == Direction.NEXT; }
    public boolean isFetchingPreviousPage() { return direction == Direction.PREVIOUS; }
    public boolean hasError()               { return error != null; }
}
