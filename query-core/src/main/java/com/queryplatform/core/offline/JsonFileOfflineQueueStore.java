package com.queryplatform.core.offline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Keeps the queue as a JSON array in one file. Writes go to a sibling temp file that is then
 * moved over the target, so a crash mid-write leaves the previous queue intact.
 *
 * <p>The {@link ObjectMapper} must have the JSR-310 module registered for {@code createdAt}.
 */
public class JsonFileOfflineQueueStore implements OfflineQueueStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileOfflineQueueStore.class);

    private static final TypeReference<List<OfflineMutationEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileOfflineQueueStore(Path file, ObjectMapper objectMapper) {
        this.file         = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void save(List<OfflineMutationEntry> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), entries);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("OFFLINE_QUEUE_SAVED file={} entries={}", file, entries.size());
        } catch (IOException e) {
            throw new OfflineQueueException("Failed to write offline queue to " + file, e);
        }
    }

    @Override
    public synchronized List<OfflineMutationEntry> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<OfflineMutationEntry> entries = objectMapper.readValue(file.toFile(), ENTRY_LIST);
            log.debug("OFFLINE_QUEUE_LOADED file={} entries={}", file, entries.size());
            return entries;
        } catch (IOException e) {
            throw new OfflineQueueException("Failed to read offline queue from " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
