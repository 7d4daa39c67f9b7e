package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheEntry;
import com.queryplatform.core.model.QueryKey;
import com.queryplatform.core.query.InfiniteQueryState.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Paginated query: an ordered list of {@link Page}s grown one page at a time.
 *
 * <p>Each page fetch appends (or prepends) a loading slot and fills it with data or an error;
 * a failing page never removes its neighbours. When the list grows past
 * {@link InfiniteQueryOptions#maxPages()} the page at the opposite end is dropped. Page fetches
 * share one in-flight attempt per query, so circuit breaking, retry and cancellation apply per
 * query, not per page. The page list is written to the cache under the query key after every
 * successful page.
 */
public class InfiniteQuery<T, P> extends AbstractQuery<InfiniteQueryState<T, P>> {

    private static final Logger log = LoggerFactory.getLogger(InfiniteQuery.class);

    private final PageFunction<T, P> pageFunction;
    private final InfiniteQueryOptions<T, P> options;

    InfiniteQuery(QueryKey key, PageFunction<T, P> pageFunction, InfiniteQueryOptions<T, P> options,
                  QueryEnvironment env) {
        super(key, options, env);
        this.pageFunction = Objects.requireNonNull(pageFunction, "pageFunction");
        this.options      = options;
        this.state        = initialState();
    }

    public InfiniteQueryOptions<T, P> options() {
        return options;
    }

    public List<Page<T, P>> pages() {
        return state().pages();
    }

    public boolean hasNextPage() {
        return nextParam(pages()) != null;
    }

    public boolean hasPreviousPage() {
        return previousParam(pages()) != null;
    }

    // ── paging ──────────────────────────────────────────────────────────────

    /**
     * Fetches the page after the last one, using {@code getNextPageParam}. Completes with the
     * current state without fetching when there is no next page.
     */
    public Mono<InfiniteQueryState<T, P>> fetchNextPage() {
        return fetchNextPage(nextParam(pages()));
    }

    public Mono<InfiniteQueryState<T, P>> fetchNextPage(P param) {
        if (param == null) {
            return Mono.just(state());
        }
        return execute(new PageFetch(Direction.NEXT, param, -1));
    }

    public Mono<InfiniteQueryState<T, P>> fetchPreviousPage() {
        P param = previousParam(pages());
        if (param == null) {
            return Mono.just(state());
        }
        return execute(new PageFetch(Direction.PREVIOUS, param, -1));
    }

    /**
     * Refetches the page at {@code index} in place; its previous data stays visible while loading
     * and survives a failure.
     *
     * @throws IndexOutOfBoundsException if there is no page at {@code index}
     */
    public Mono<InfiniteQueryState<T, P>> refetchPage(int index) {
        P param = pages().get(index).param();
        return execute(new PageFetch(Direction.REFETCH, param, index));
    }

    /** Refetches every held page in order, stopping at the first refused attempt. */
    public Mono<InfiniteQueryState<T, P>> refetchAll() {
        int count = pages().size();
        if (count == 0) {
            return fetchNextPage();
        }
        return Flux.range(0, count)
            .concatMap(this::refetchPage)
            .last();
    }

    /** Cancels in-flight work, drops all pages and the cache entry. */
    public void reset() {
        cancel();
        synchronized (lock) {
            env.cache().remove(key);
            emit(InfiniteQueryState.idle(nextParam(List.of()) != null));
        }
        log.debug("[InfiniteQuery] RESET key={}", key);
    }

    /** Replaces the page list, e.g. for an optimistic update. Cancels in-flight work. */
    public void setPages(List<Page<T, P>> pages) {
        cancel();
        synchronized (lock) {
            List<Page<T, P>> bounded = new ArrayList<>(pages);
            while (options.maxPages() > 0 && bounded.size() > options.maxPages()) {
                bounded.remove(0);
            }
            CacheEntry<List<Page<T, P>>> entry = env.cache().set(key, List.copyOf(bounded), entryOptions());
            emit(settled(bounded.isEmpty() ? QueryStatus.IDLE : QueryStatus.SUCCESS, bounded, null,
                entry.fetchedAt()));
        }
    }

    public QueryHandle<InfiniteQuery<T, P>> acquire(String ownerId) {
        addListener(ownerId);
        return new QueryHandle<>(this, ownerId);
    }

    @Override
    void onFirstListener() {
        List<Page<T, P>> pages = pages();
        if (pages.isEmpty()) {
            fetchNextPage();
        } else if (options.refetchOnMount() || isCacheStale()) {
            refetchAll().subscribe(s -> { }, e -> log.debug("[InfiniteQuery] REFETCH_ON_MOUNT_FAILED key={} error={}",
                                                              key, e.getMessage()));
        }
    }

    @Override
    InfiniteQueryState<T, P> cancelledState(InfiniteQueryState<T, P> current) {
        List<Page<T, P>> pages = new ArrayList<>();
        for (Page<T, P> page : current.pages()) {
            Page<T, P> restored = page.toCancelled();
            if (restored != null) {
                pages.add(restored);
            }
        }
        QueryStatus status = pages.stream().anyMatch(Page::hasData) ? QueryStatus.SUCCESS : QueryStatus.IDLE;
        return settled(status, pages, null, current.dataUpdatedAt());
    }

    // ── page fetch ──────────────────────────────────────────────────────────

    private final class PageFetch extends Fetch<T> {
        private final Direction direction;
        private final P param;
        private final int refetchIndex;
        private boolean slotted;

        PageFetch(Direction direction, P param, int refetchIndex) {
            super(false);
            this.direction    = direction;
            this.param        = param;
            this.refetchIndex = refetchIndex;
        }

        @Override
        InfiniteQueryState<T, P> loading(InfiniteQueryState<T, P> current) {
            List<Page<T, P>> pages = new ArrayList<>(current.pages());
            switch (direction) {
                case NEXT:
                    pages.add(Page.loading(param));
                    while (overCapacity(pages)) {
                        pages.remove(0);
                    }
                    break;
                case PREVIOUS:
                    pages.add(0, Page.loading(param));
                    while (overCapacity(pages)) {
                        pages.remove(pages.size() - 1);
                    }
                    break;
                case REFETCH:
                    pages.set(refetchIndex, pages.get(refetchIndex).toLoading());
                    break;
                default:
                    throw new IllegalStateException("Unknown direction: " + direction);
            }
            slotted = true;
            return new InfiniteQueryState<>(QueryStatus.LOADING, pages, current.error(), true, direction,
                current.hasNextPage(), current.hasPreviousPage(), current.dataUpdatedAt());
        }

        @Override
        Mono<T> call(CancellationToken token) {
            return pageFunction.fetchPage(param, token);
        }

        @Override
        InfiniteQueryState<T, P> commit(InfiniteQueryState<T, P> current, T data) {
            Instant now = env.clock().instant();
            List<Page<T, P>> pages = new ArrayList<>(current.pages());
            pages.set(slotIndex(pages), Page.success(param, data, now));
            env.cache().set(key, List.copyOf(pages), entryOptions());
            log.debug("[InfiniteQuery] PAGE_LOADED key={} param={} pages={}", key, param, pages.size());
            return settled(QueryStatus.SUCCESS, pages, null, now);
        }

        @Override
        InfiniteQueryState<T, P> fail(InfiniteQueryState<T, P> current, Throwable error) {
            List<Page<T, P>> pages = new ArrayList<>(current.pages());
            if (slotted) {
                int index = slotIndex(pages);
                pages.set(index, pages.get(index).toFailed(error));
            }
            return settled(QueryStatus.ERROR, pages, error, current.dataUpdatedAt());
        }

        private int slotIndex(List<Page<T, P>> pages) {
            switch (direction) {
                case NEXT:
                    return pages.size() - 1;
                case PREVIOUS:
                    return 0;
                default:
                    return refetchIndex;
            }
        }
    }

    // ── internals ───────────────────────────────────────────────────────────

    private InfiniteQueryState<T, P> settled(QueryStatus status, List<Page<T, P>> pages, Throwable error,
                                             Instant dataUpdatedAt) {
        return new InfiniteQueryState<>(status, pages, error, false, null,
            nextParam(pages) != null, previousParam(pages) != null, dataUpdatedAt);
    }

    private boolean overCapacity(List<Page<T, P>> pages) {
        return options.maxPages() > 0 && pages.size() > options.maxPages();
    }

    private P nextParam(List<Page<T, P>> pages) {
        if (pages.isEmpty() && options.initialPageParam() != null) {
            return options.initialPageParam();
        }
        T lastData = null;
        for (int i = pages.size() - 1; i >= 0; i--) {
            if (pages.get(i).hasData()) {
                lastData = pages.get(i).data();
                break;
            }
        }
        return options.getNextPageParam().apply(pages, lastData);
    }

    private P previousParam(List<Page<T, P>> pages) {
        if (options.getPreviousPageParam() == null || pages.isEmpty()) {
            return null;
        }
        T firstData = pages.stream().filter(Page::hasData).map(Page::data).findFirst().orElse(null);
        return options.getPreviousPageParam().apply(pages, firstData);
    }

    private InfiniteQueryState<T, P> initialState() {
        Instant now = env.clock().instant();
        return env.cache().inspect(key)
            .filter(entry -> !entry.isExpired(now) && entry.data() instanceof List)
            .map(entry -> settled(QueryStatus.SUCCESS, this.<List<Page<T, P>>>cast(entry.data()), null,
                entry.fetchedAt()))
            .orElseGet(() -> InfiniteQueryState.idle(nextParam(List.of()) != null));
    }

    @SuppressWarnings("unchecked")
    private <V> V cast(Object value) {
        return (V) value;
    }
}
