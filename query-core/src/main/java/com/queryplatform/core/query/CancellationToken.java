package com.queryplatform.core.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal handed to every fetch function.
 *
 * <p>Cancelling does not interrupt anything by itself: fetch functions are expected to check
 * {@link #isCancelled()}, call {@link #throwIfCancelled()}, or compose with {@link #cancelled()}.
 * A child token created with {@link #createChild()} is cancelled whenever its parent is.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Sinks.Empty<Void> cancelledSignal = Sinks.empty();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /** Idempotent. Callbacks run once, on the cancelling thread. */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationToken::runSafely);
        cancelledSignal.tryEmitEmpty();
    }

    /** Completes (empty) when the token is cancelled. */
    public Mono<Void> cancelled() {
        return cancelledSignal.asMono();
    }

    /**
     * Registers {@code callback} to run on cancellation; runs it immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runSafely(callback);
    }

    public CancellationToken createChild() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancelledException();
        }
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("CANCEL_CALLBACK_FAILED: {}", e.getMessage(), e);
        }
    }
}
