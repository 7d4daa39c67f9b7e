package com.queryplatform.core.offline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Mutation type to {@link MutationHandler}. Register handlers at startup, before the first
 * reconnect can trigger a replay.
 */
public class MutationHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(MutationHandlerRegistry.class);

    private final Map<String, MutationHandler> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public MutationHandlerRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(String mutationType, MutationHandler handler) {
        MutationHandler previous = handlers.put(mutationType, handler);
        if (previous != null) {
            log.warn("MUTATION_HANDLER_REPLACED type={}", mutationType);
        }
    }

    /**
     * Registers a handler that receives the variables converted back to {@code variablesType}.
     * A conversion failure fails the replay, keeping the entry queued.
     */
    public <V> void register(String mutationType, Class<V> variablesType, Function<V, Mono<?>> handler) {
        register(mutationType, variables -> {
            V typed;
            try {
                typed = objectMapper.treeToValue(variables, variablesType);
            } catch (JsonProcessingException e) {
                return Mono.error(new OfflineQueueException(
                    "Cannot convert variables of " + mutationType + " to " + variablesType.getSimpleName(), e));
            }
            return handler.apply(typed);
        });
    }

    public void unregister(String mutationType) {
        handlers.remove(mutationType);
    }

    public Optional<MutationHandler> find(String mutationType) {
        return Optional.ofNullable(handlers.get(mutationType));
    }

    public boolean contains(String mutationType) {
        return handlers.containsKey(mutationType);
    }

    public Set<String> types() {
        return Set.copyOf(handlers.keySet());
    }
}
