package com.queryplatform.core.offline;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A mutation attempted while offline, waiting for replay.
 *
 * @param key          string form of the query key the mutation concerns
 * @param mutationType selects the {@link MutationHandler} used on replay
 * @param variables    mutation input as a JSON tree, so the queue can be persisted without
 *                     knowing the concrete input types
 * @param attempts     failed replays so far
 * @param lastError    message of the most recent replay failure, {@code null} if none
 */
public record OfflineMutationEntry(
    UUID id,
    String key,
    String mutationType,
    JsonNode variables,
    Instant createdAt,
    int attempts,
    String lastError
) {

    public OfflineMutationEntry withFailure(String error) {
        return new OfflineMutationEntry(id, key, mutationType, variables, createdAt, attempts + 1, error);
    }
}
