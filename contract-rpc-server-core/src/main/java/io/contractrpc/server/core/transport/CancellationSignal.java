package io.contractrpc.server.core.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot notification that a connection is going away.
 *
 * <p>Handlers can either poll {@link #isCancelled()} between work units or register callbacks with
 * {@link #onCancel(Runnable)}. A callback registered after the signal fired runs immediately on the
 * registering thread.
 */
public final class CancellationSignal {

    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationSignal.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runQuietly(callback);
    }

    /**
     * @return {@code true} for the call that actually fired the signal
     */
    boolean fire() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) return false;
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationSignal::runQuietly);
        return true;
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Cancellation callback failed", e);
        }
    }
}
