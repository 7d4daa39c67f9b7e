package com.queryplatform.core.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-size pool for CPU-bound work such as parsing or reshaping fetched payloads.
 *
 * <p>Tasks beyond the pool size wait in the executor's queue. Whatever a task throws reaches the
 * subscriber as a {@link WorkerExecutionException} with the original as cause.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int size;
    private final ExecutorService executor;
    private final Scheduler scheduler;
    private final AtomicInteger pending = new AtomicInteger();

    public WorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool size must be >= 1: " + size);
        }
        this.size      = size;
        this.executor  = Executors.newFixedThreadPool(size, daemonThreads("query-worker"));
        this.scheduler = Schedulers.fromExecutorService(executor, "query-worker");
        log.info("WORKER_POOL_STARTED size={}", size);
    }

    /**
     * Runs {@code task.apply(input)} on a pool thread. Lazy: nothing is submitted until the
     * returned {@code Mono} is subscribed. A {@code null} result completes empty.
     */
    public <I, R> Mono<R> execute(Function<I, R> task, I input) {
        return Mono.fromCallable(() -> task.apply(input))
            .subscribeOn(scheduler)
            .doOnSubscribe(s -> pending.incrementAndGet())
            .doFinally(signal -> pending.decrementAndGet())
            .onErrorMap(e -> !(e instanceof WorkerExecutionException),
                        e -> new WorkerExecutionException("Worker task failed: " + e.getMessage(), e));
    }

    public int size() {
        return size;
    }

    /** Tasks submitted and not yet finished, including queued ones. */
    public int pendingTasks() {
        return pending.get();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        scheduler.dispose();
        executor.shutdownNow();
        log.info("WORKER_POOL_STOPPED size={}", size);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
