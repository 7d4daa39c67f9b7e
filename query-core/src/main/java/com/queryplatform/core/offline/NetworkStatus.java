package com.queryplatform.core.offline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Connectivity flag fed by the host (a connectivity callback, a health probe, ...).
 * Consecutive identical values are collapsed, so every published value is a transition.
 */
public class NetworkStatus {

    private static final Logger log = LoggerFactory.getLogger(NetworkStatus.class);

    private final Sinks.Many<Boolean> changes = Sinks.many().multicast().directBestEffort();
    private boolean online;

    public NetworkStatus() {
        this(true);
    }

    public NetworkStatus(boolean initiallyOnline) {
        this.online = initiallyOnline;
    }

    public synchronized boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        synchronized (this) {
            if (this.online == online) {
                return;
            }
            this.online = online;
            changes.tryEmitNext(online);
        }
        log.info("NETWORK_STATUS online={}", online);
    }

    /** Transitions only; the first event is the first change after subscription. */
    public Flux<Boolean> changes() {
        return changes.asFlux().onBackpressureBuffer();
    }
}
