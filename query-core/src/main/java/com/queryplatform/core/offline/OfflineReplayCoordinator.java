package com.queryplatform.core.offline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Replays the offline queue every time {@link NetworkStatus} goes from offline to online.
 * Since the status publishes transitions only, every {@code true} it emits is such a transition.
 */
public class OfflineReplayCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OfflineReplayCoordinator.class);

    private final NetworkStatus networkStatus;
    private final OfflineQueueManager queue;
    private Disposable subscription;

    public OfflineReplayCoordinator(NetworkStatus networkStatus, OfflineQueueManager queue) {
        this.networkStatus = networkStatus;
        this.queue         = queue;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = networkStatus.changes()
            .filter(Boolean::booleanValue)
            .concatMap(online -> queue.processQueue()
                .onErrorResume(e -> {
                    log.warn("OFFLINE_REPLAY_ERROR error={}", e.getMessage(), e);
                    return Mono.empty();
                }))
            .subscribe(report -> log.debug("OFFLINE_RECONNECT_REPLAYED total={}", report.total()));
        log.info("OFFLINE_REPLAY_COORDINATOR_STARTED");
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("OFFLINE_REPLAY_COORDINATOR_STOPPED");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
