package com.queryplatform.spring.offline;

import com.queryplatform.core.offline.NetworkStatus;
import com.queryplatform.core.offline.OfflineMutationEntry;
import com.queryplatform.core.offline.OfflineQueueManager;
import com.queryplatform.core.offline.OfflineReplayCoordinator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Restores the persisted offline queue on startup, then replays it on every reconnect until
 * the context closes.
 *
 * <p>A store that cannot be read is logged and the queue starts empty; replay still starts, so
 * mutations queued from now on are not lost on reconnect.
 */
public class OfflineReplayScheduler {

    private static final Logger log = LoggerFactory.getLogger(OfflineReplayScheduler.class);

    private static final Duration LOAD_TIMEOUT = Duration.ofSeconds(30);

    private final OfflineQueueManager queue;
    private final OfflineReplayCoordinator coordinator;

    public OfflineReplayScheduler(NetworkStatus networkStatus, OfflineQueueManager queue) {
        this.queue       = queue;
        this.coordinator = new OfflineReplayCoordinator(networkStatus, queue);
    }

    @PostConstruct
    public void start() {
        try {
            List<OfflineMutationEntry> restored = queue.load().block(LOAD_TIMEOUT);
            log.info("Offline replay started. restoredEntries={}", restored == null ? 0 : restored.size());
        } catch (RuntimeException e) {
            log.warn("Offline queue could not be restored, starting empty: {}", e.getMessage(), e);
        }
        coordinator.start();
    }

    @PreDestroy
    public void stop() {
        coordinator.stop();
    }

    public boolean isRunning() {
        return coordinator.isRunning();
    }
}
