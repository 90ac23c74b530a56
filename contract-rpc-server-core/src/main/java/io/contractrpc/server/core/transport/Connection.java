package io.contractrpc.server.core.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection state owned by one transport.
 *
 * <p>Teardown fires the {@link CancellationSignal} and runs every registered {@link Cleanup} exactly once,
 * whichever of client disconnect, explicit close or handler failure happens first.
 */
public final class Connection {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final String id;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final CancellationSignal signal = new CancellationSignal();
    private final List<Cleanup> cleanups = new ArrayList<>();
    private boolean released;

    public Connection(String endpointName) {
        this.id = Objects.requireNonNull(endpointName, "endpointName") + "#" + IDS.incrementAndGet();
    }

    public String id() {
        return id;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    public CancellationSignal signal() {
        return signal;
    }

    /**
     * {@code CONNECTING -> OPEN}.
     *
     * @return {@code false} if the connection already left {@code CONNECTING}
     */
    public boolean open() {
        boolean opened = state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
        if (opened) LOGGER.debug("Connection {} open", id);
        return opened;
    }

    /**
     * Moves to {@code CLOSING}. Only the first caller wins; it must follow up with {@link #finish()}.
     */
    public boolean beginClose() {
        while (true) {
            ConnectionState current = state.get();
            if (!current.canMoveTo(ConnectionState.CLOSING)) return false;
            if (state.compareAndSet(current, ConnectionState.CLOSING)) {
                LOGGER.debug("Connection {} closing", id);
                return true;
            }
        }
    }

    /**
     * Moves to {@code CLOSED}, fires the signal and releases cleanups. Idempotent.
     */
    public void finish() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous != ConnectionState.CLOSED) LOGGER.debug("Connection {} closed", id);
        signal.fire();
        List<Cleanup> toRun;
        synchronized (cleanups) {
            if (released) return;
            released = true;
            toRun = new ArrayList<>(cleanups);
            cleanups.clear();
        }
        toRun.forEach(this::runCleanup);
    }

    /**
     * {@link #beginClose()} followed by {@link #finish()}.
     */
    public void close() {
        beginClose();
        finish();
    }

    /**
     * Registers a release action. After teardown the action runs immediately.
     */
    public void addCleanup(Cleanup cleanup) {
        if (cleanup == null) return;
        synchronized (cleanups) {
            if (!released) {
                cleanups.add(cleanup);
                return;
            }
        }
        runCleanup(cleanup);
    }

    private void runCleanup(Cleanup cleanup) {
        try {
            cleanup.run();
        } catch (Exception e) {
            LOGGER.warn("Cleanup for connection {} failed", id, e);
        }
    }

    @Override
    public String toString() {
        return "Connection[" + id + ", " + state.get() + "]";
    }
}
