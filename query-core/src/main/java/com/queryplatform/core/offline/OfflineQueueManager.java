package com.queryplatform.core.offline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryplatform.core.model.QueryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Durable FIFO queue of mutations attempted while offline.
 *
 * <p><strong>Write-through:</strong> every change is saved to the {@link OfflineQueueStore}
 * before it becomes visible in memory and on {@link #stream()}; if the save fails the queue is
 * left as it was and the returned {@code Mono} errors with {@link OfflineQueueException}.
 *
 * <p><strong>Replay:</strong> {@link #processQueue()} runs entries oldest first through the
 * handler registered for their mutation type. Success removes the entry; failure increments
 * {@code attempts}, records {@code lastError} and keeps it; entries with no registered handler
 * are dropped with a warning. Only one pass runs at a time.
 *
 * <p>All operations are lazy and run on the I/O scheduler when subscribed.
 */
public class OfflineQueueManager {

    private static final Logger log = LoggerFactory.getLogger(OfflineQueueManager.class);

    private enum Outcome { SUCCEEDED, FAILED, DROPPED }

    private final OfflineQueueStore store;
    private final MutationHandlerRegistry handlers;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler ioScheduler;
    private final Sinks.Many<List<OfflineMutationEntry>> snapshots = Sinks.many().multicast().directBestEffort();
    private final AtomicBoolean processing = new AtomicBoolean();

    private List<OfflineMutationEntry> entries = List.of();

    public OfflineQueueManager(OfflineQueueStore store, MutationHandlerRegistry handlers, ObjectMapper objectMapper) {
        this(store, handlers, objectMapper, Clock.systemUTC(), Schedulers.boundedElastic());
    }

    public OfflineQueueManager(OfflineQueueStore store, MutationHandlerRegistry handlers, ObjectMapper objectMapper,
                               Clock clock, Scheduler ioScheduler) {
        this.store        = store;
        this.handlers     = handlers;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.ioScheduler  = ioScheduler;
    }

    // ── queue operations ────────────────────────────────────────────────────

    public Mono<OfflineMutationEntry> enqueue(QueryKey key, String mutationType, Object variables) {
        return enqueue(key.asString(), mutationType, variables);
    }

    /**
     * Appends a new entry with a fresh id and zero attempts. {@code variables} is converted to a
     * JSON tree with the manager's {@link ObjectMapper}.
     */
    public Mono<OfflineMutationEntry> enqueue(String key, String mutationType, Object variables) {
        return Mono.fromCallable(() -> {
            JsonNode tree = objectMapper.valueToTree(variables);
            OfflineMutationEntry entry = new OfflineMutationEntry(UUID.randomUUID(), key, mutationType, tree,
                clock.instant(), 0, null);
            commit(current -> {
                List<OfflineMutationEntry> next = new ArrayList<>(current);
                next.add(entry);
                return next;
            });
            log.info("OFFLINE_ENQUEUED id={} key={} type={}", entry.id(), key, mutationType);
            return entry;
        }).subscribeOn(ioScheduler);
    }

    /** @return whether an entry with {@code id} was queued */
    public Mono<Boolean> remove(UUID id) {
        return Mono.fromCallable(() -> {
            boolean[] found = {false};
            commit(current -> {
                List<OfflineMutationEntry> next = new ArrayList<>(current);
                found[0] = next.removeIf(e -> e.id().equals(id));
                return next;
            });
            log.debug("OFFLINE_REMOVED id={} found={}", id, found[0]);
            return found[0];
        }).subscribeOn(ioScheduler);
    }

    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> {
            commit(current -> List.of());
            log.info("OFFLINE_CLEARED");
        }).subscribeOn(ioScheduler).then();
    }

    /**
     * Replaces the in-memory queue with the store's contents, e.g. after a restart.
     */
    public Mono<List<OfflineMutationEntry>> load() {
        return Mono.fromCallable(() -> {
            List<OfflineMutationEntry> loaded = store.load();
            synchronized (this) {
                entries = List.copyOf(loaded);
                snapshots.tryEmitNext(entries);
            }
            log.info("OFFLINE_LOADED entries={}", loaded.size());
            return entries();
        }).subscribeOn(ioScheduler);
    }

    public synchronized List<OfflineMutationEntry> entries() {
        return entries;
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Every change as a full, immutable snapshot of the queue. */
    public Flux<List<OfflineMutationEntry>> stream() {
        return snapshots.asFlux().onBackpressureBuffer();
    }

    // ── replay ──────────────────────────────────────────────────────────────

    /**
     * Replays the queue once, oldest entry first. Completes with {@link ReplayReport#EMPTY}
     * without doing anything if another pass is already running.
     */
    public Mono<ReplayReport> processQueue() {
        return Mono.defer(() -> {
            if (!processing.compareAndSet(false, true)) {
                log.debug("OFFLINE_REPLAY_SKIPPED reason=already_running");
                return Mono.just(ReplayReport.EMPTY);
            }
            List<OfflineMutationEntry> pending = entries();
            log.info("OFFLINE_REPLAY_STARTED entries={}", pending.size());
            return Flux.fromIterable(pending)
                .concatMap(this::replay)
                .collectList()
                .map(OfflineQueueManager::summarise)
                .doOnNext(report -> log.info("OFFLINE_REPLAY_FINISHED succeeded={} failed={} dropped={}",
                                             report.succeeded(), report.failed(), report.dropped()))
                .doFinally(signal -> processing.set(false));
        });
    }

    private Mono<Outcome> replay(OfflineMutationEntry entry) {
        MutationHandler handler = handlers.find(entry.mutationType()).orElse(null);
        if (handler == null) {
            log.warn("OFFLINE_REPLAY_UNKNOWN_TYPE id={} type={}: dropping entry", entry.id(), entry.mutationType());
            return remove(entry.id()).thenReturn(Outcome.DROPPED);
        }
        return Mono.defer(() -> handler.execute(entry.variables()))
            .then(remove(entry.id()))
            .thenReturn(Outcome.SUCCEEDED)
            .onErrorResume(e -> {
                log.warn("OFFLINE_REPLAY_FAILED id={} type={} attempts={} error={}",
                         entry.id(), entry.mutationType(), entry.attempts() + 1, e.getMessage());
                return markFailed(entry.id(), String.valueOf(e.getMessage())).thenReturn(Outcome.FAILED);
            });
    }

    private Mono<Void> markFailed(UUID id, String error) {
        return Mono.fromRunnable(() -> commit(current -> {
            List<OfflineMutationEntry> next = new ArrayList<>(current.size());
            for (OfflineMutationEntry e : current) {
                next.add(e.id().equals(id) ? e.withFailure(error) : e);
            }
            return next;
        })).subscribeOn(ioScheduler).then();
    }

    private static ReplayReport summarise(List<Outcome> outcomes) {
        int succeeded = 0;
        int failed = 0;
        int dropped = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome) {
                case SUCCEEDED: succeeded++; break;
                case FAILED:    failed++;    break;
                default:        dropped++;   break;
            }
        }
        return new ReplayReport(succeeded, failed, dropped);
    }

    // ── internals ───────────────────────────────────────────────────────────

    private synchronized void commit(UnaryOperator<List<OfflineMutationEntry>> change) {
        List<OfflineMutationEntry> next = List.copyOf(change.apply(entries));
        try {
            store.save(next);
        } catch (OfflineQueueException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OfflineQueueException("Failed to persist offline queue", e);
        }
        entries = next;
        snapshots.tryEmitNext(next);
    }
}
