package com.queryplatform.core.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scope-keyed breakers plus global open-event listeners.
 *
 * <p>Every breaker created here reports its open transitions to all registered
 * {@link CircuitOpenListener}s regardless of scope. A listener that throws is logged and the
 * rest still run.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<CircuitOpenListener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the breaker for {@code scope}, creating it with {@code options} on first use.
     */
    public CircuitBreaker getOrCreate(String scope, CircuitBreakerOptions options) {
        return breakers.computeIfAbsent(scope, s -> {
            log.debug("CIRCUIT_CREATED scope={} failureThreshold={}", s, options.failureThreshold());
            return new CircuitBreaker(s, options, clock, this::publishOpen);
        });
    }

    public Optional<CircuitBreaker> get(String scope) {
        return Optional.ofNullable(breakers.get(scope));
    }

    public boolean contains(String scope) {
        return breakers.containsKey(scope);
    }

    public Set<String> scopes() {
        return Set.copyOf(breakers.keySet());
    }

    public void reset(String scope) {
        CircuitBreaker breaker = breakers.get(scope);
        if (breaker != null) {
            breaker.reset();
            log.info("CIRCUIT_RESET scope={}", scope);
        }
    }

    public void clearAll() {
        breakers.clear();
    }

    public void addOpenListener(CircuitOpenListener listener) {
        listeners.add(listener);
    }

    public void removeOpenListener(CircuitOpenListener listener) {
        listeners.remove(listener);
    }

    private void publishOpen(CircuitOpenEvent event) {
        for (CircuitOpenListener listener : listeners) {
            try {
                listener.onOpen(event);
            } catch (RuntimeException e) {
                log.warn("CIRCUIT_LISTENER_FAILED scope={}: {}", event.scope(), e.getMessage(), e);
            }
        }
    }
}
