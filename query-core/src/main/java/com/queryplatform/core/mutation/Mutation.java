package com.queryplatform.core.mutation;

import com.queryplatform.core.model.QueryKey;
import com.queryplatform.core.offline.MutationHandlerRegistry;
import com.queryplatform.core.offline.NetworkStatus;
import com.queryplatform.core.offline.OfflineQueueManager;
import com.queryplatform.core.query.QueryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a caller-supplied write and tracks its state.
 *
 * <p>With {@link MutationOptions#queueWhenOffline()} set and the network down, the call is not
 * attempted: the variables go to the {@link OfflineQueueManager} and the state becomes
 * {@code QUEUED}. Register the same function with {@link #registerReplayHandler} so the queue
 * can replay it on reconnect. After a successful run the keys in
 * {@link MutationOptions#invalidates()} are invalidated on the client.
 */
public class Mutation<V, R> {

    private static final Logger log = LoggerFactory.getLogger(Mutation.class);

    private final Function<V, Mono<R>> mutationFunction;
    private final MutationOptions<R> options;
    private final QueryClient client;
    private final NetworkStatus networkStatus;
    private final OfflineQueueManager offlineQueue;
    private final Sinks.Many<MutationState<R>> states = Sinks.many().multicast().directBestEffort();

    private MutationState<R> state = MutationState.idle();

    /**
     * @param client        used for post-success invalidation, may be {@code null}
     * @param networkStatus may be {@code null}, meaning always online
     * @param offlineQueue  may be {@code null}, meaning never queue
     */
    public Mutation(Function<V, Mono<R>> mutationFunction, MutationOptions<R> options, QueryClient client,
                    NetworkStatus networkStatus, OfflineQueueManager offlineQueue) {
        this.mutationFunction = Objects.requireNonNull(mutationFunction, "mutationFunction");
        this.options          = Objects.requireNonNull(options, "options");
        this.client           = client;
        this.networkStatus    = networkStatus;
        this.offlineQueue     = offlineQueue;
    }

    /**
     * Runs (or queues) the mutation when subscribed. Errors of the mutation function are
     * captured in the returned state; only a failure to enqueue is signalled as an error.
     */
    public Mono<MutationState<R>> mutate(V variables) {
        return Mono.defer(() -> {
            if (shouldQueue()) {
                String key = options.key() != null ? options.key().asString() : options.mutationType();
                return offlineQueue.enqueue(key, options.mutationType(), variables)
                    .map(entry -> {
                        log.info("MUTATION_QUEUED type={} entryId={}", options.mutationType(), entry.id());
                        return publish(MutationState.<R>queued(entry.id()));
                    });
            }
            publish(MutationState.loading());
            return Mono.defer(() -> mutationFunction.apply(variables))
                .singleOptional()
                .map(result -> {
                    R data = result.orElse(null);
                    invalidateTargets();
                    runCallback(options.onSuccess(), data);
                    return publish(MutationState.success(data));
                })
                .onErrorResume(e -> {
                    log.warn("MUTATION_FAILED type={} error={}", options.mutationType(), e.getMessage());
                    runCallback(options.onError(), e);
                    return Mono.just(publish(MutationState.failed(e)));
                });
        });
    }

    /**
     * Registers this mutation's function as the offline replay handler for its type.
     */
    public void registerReplayHandler(MutationHandlerRegistry registry, Class<V> variablesType) {
        registry.register(options.mutationType(), variablesType, mutationFunction::apply);
    }

    public synchronized MutationState<R> state() {
        return state;
    }

    public Flux<MutationState<R>> stream() {
        return states.asFlux().onBackpressureBuffer();
    }

    public void reset() {
        publish(MutationState.idle());
    }

    public MutationOptions<R> options() {
        return options;
    }

    private boolean shouldQueue() {
        return options.queueWhenOffline() && offlineQueue != null
            && networkStatus != null && !networkStatus.isOnline();
    }

    private void invalidateTargets() {
        if (client == null) {
            return;
        }
        for (QueryKey key : options.invalidates()) {
            client.invalidateQuery(key);
        }
    }

    private synchronized MutationState<R> publish(MutationState<R> next) {
        state = next;
        states.tryEmitNext(next);
        return next;
    }

    private <A> void runCallback(Consumer<A> callback, A value) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            log.warn("MUTATION_CALLBACK_FAILED type={}: {}", options.mutationType(), e.getMessage(), e);
        }
    }
}
