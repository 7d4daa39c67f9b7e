package com.queryplatform.core.offline;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Replays one queued mutation. Completing normally (with or without a value) removes the entry
 * from the queue; an error keeps it for the next reconnect.
 */
@FunctionalInterface
public interface MutationHandler {

    Mono<?> execute(JsonNode variables);
}
