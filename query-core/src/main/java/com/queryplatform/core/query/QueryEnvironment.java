package com.queryplatform.core.query;

import com.queryplatform.core.cache.CacheStore;
import com.queryplatform.core.circuit.CircuitBreakerRegistry;
import com.queryplatform.core.dependency.DependencyManager;
import com.queryplatform.core.error.ErrorReporter;
import com.queryplatform.core.worker.WorkerPool;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Collaborators a {@link QueryClient} shares with every query it creates.
 *
 * @param workerPool  {@code null} when transformers run inline
 * @param reporters   live list owned by the client
 * @param onDisposed  invoked once by a query after it disposed itself
 */
record QueryEnvironment(
    CacheStore cache,
    CircuitBreakerRegistry breakers,
    DependencyManager dependencies,
    WorkerPool workerPool,
    Scheduler scheduler,
    Clock clock,
    QueryClientConfig config,
    List<ErrorReporter> reporters,
    BooleanSupplier online,
    Consumer<AbstractQuery<?>> onDisposed
) {}
