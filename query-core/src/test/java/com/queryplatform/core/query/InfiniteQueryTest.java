package com.queryplatform.core.query;

import com.queryplatform.core.MutableClock;
import com.queryplatform.core.model.QueryKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InfiniteQueryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final QueryKey FEED = QueryKey.of("feed");

    private QueryClient client;

    @BeforeEach
    void setUp() {
        QueryClientConfig config = QueryClientConfig.defaults()
            .withDisposeDelay(Duration.ofMinutes(1))
            .withDefaultRetryPolicy(RetryPolicy.none())
            .withWorkerPoolSize(0);
        client = new QueryClient(config, new MutableClock(), Schedulers.parallel(), null);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    /** Page {@code n} holds "item-n"; page 2 always fails. */
    private static Mono<String> pageTwoFails(Integer page, CancellationToken token) {
        return page == 2 ? Mono.error(new IllegalStateException("page 2 down")) : Mono.just("item-" + page);
    }

    private static List<Integer> params(InfiniteQueryState<String, Integer> state) {
        return state.pages().stream().map(Page::param).collect(Collectors.toList());
    }

    @Test
    @DisplayName("pages 1..3 with page 2 failing → neighbours keep their data")
    void failingPage_keepsNeighbours() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED, InfiniteQueryTest::pageTwoFails,
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.size() + 1));

        assertEquals(QueryStatus.SUCCESS, feed.fetchNextPage().block(TIMEOUT).status());
        InfiniteQueryState<String, Integer> afterFailure = feed.fetchNextPage().block(TIMEOUT);
        assertEquals(QueryStatus.ERROR, afterFailure.status());
        InfiniteQueryState<String, Integer> state = feed.fetchNextPage().block(TIMEOUT);

        assertEquals(List.of(1, 2, 3), params(state));
        assertEquals("item-1", state.pages().get(0).data());
        assertTrue(state.pages().get(1).isError());
        assertEquals("page 2 down", state.pages().get(1).error().getMessage());
        assertEquals("item-3", state.pages().get(2).data());
        assertEquals(QueryStatus.SUCCESS, state.status());
    }

    @Test
    @DisplayName("maxPages 2, three pages fetched → oldest dropped")
    void maxPages_dropsOppositeEnd() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> Mono.just("item-" + page),
            InfiniteQueryOptions.<String, Integer>of(
                (pages, last) -> pages.isEmpty() ? 1 : pages.get(pages.size() - 1).param() + 1)
                .withMaxPages(2));

        feed.fetchNextPage().block(TIMEOUT);
        feed.fetchNextPage().block(TIMEOUT);
        InfiniteQueryState<String, Integer> state = feed.fetchNextPage().block(TIMEOUT);

        assertEquals(List.of(2, 3), params(state));
        assertEquals(List.of("item-2", "item-3"), state.pageData());
    }

    @Test
    @DisplayName("previous page → prepended, hasPreviousPage false at page 1")
    void previousPage_prepends() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> Mono.just("item-" + page),
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.get(pages.size() - 1).param() + 1)
                .withInitialPageParam(2)
                .withPreviousPageParam((pages, first) -> pages.get(0).param() > 1 ? pages.get(0).param() - 1 : null));

        feed.fetchNextPage().block(TIMEOUT);
        assertTrue(feed.hasPreviousPage());
        InfiniteQueryState<String, Integer> state = feed.fetchPreviousPage().block(TIMEOUT);

        assertEquals(List.of(1, 2), params(state));
        assertFalse(state.hasPreviousPage());
        assertEquals(state, feed.fetchPreviousPage().block(TIMEOUT), "no previous page → state unchanged");
    }

    @Test
    @DisplayName("successful page → page list written to the cache")
    void pages_cached() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> Mono.just("item-" + page),
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.size() + 1));

        feed.fetchNextPage().block(TIMEOUT);
        feed.fetchNextPage().block(TIMEOUT);

        Object cached = client.getQueryData(FEED);
        assertTrue(cached instanceof List);
        assertEquals(2, ((List<?>) cached).size());
    }

    @Test
    @DisplayName("reset → pages and cache entry gone")
    void reset_clearsPages() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> Mono.just("item-" + page),
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.size() + 1));
        feed.fetchNextPage().block(TIMEOUT);

        feed.reset();

        assertTrue(feed.pages().isEmpty());
        assertFalse(client.cache().contains(FEED));
        assertTrue(feed.hasNextPage());
    }

    @Test
    @DisplayName("cancel while loading a page → loading slot dropped")
    void cancel_dropsLoadingSlot() {
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> page == 1 ? Mono.just("item-1") : Mono.never(),
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.size() + 1));
        feed.fetchNextPage().block(TIMEOUT);
        feed.fetchNextPage();
        assertEquals(2, feed.pages().size());

        feed.cancel();

        assertEquals(List.of(1), params(feed.state()));
        assertEquals(QueryStatus.SUCCESS, feed.state().status());
    }

    @Test
    @DisplayName("refetchPage → data replaced in place")
    void refetchPage_inPlace() {
        int[] version = {0};
        InfiniteQuery<String, Integer> feed = client.getInfiniteQuery(FEED,
            (Integer page, CancellationToken token) -> Mono.just("item-" + page + "-v" + version[0]),
            InfiniteQueryOptions.<String, Integer>of((pages, last) -> pages.size() + 1));
        feed.fetchNextPage().block(TIMEOUT);
        feed.fetchNextPage().block(TIMEOUT);

        version[0] = 1;
        InfiniteQueryState<String, Integer> state = feed.refetchPage(0).block(TIMEOUT);

        assertEquals(List.of("item-1-v1", "item-2-v0"), state.pageData());
    }
}
