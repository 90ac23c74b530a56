package io.contractrpc.server.core.transport;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-subscriber publisher feeding one connection's frames to the HTTP adapter.
 *
 * <p>All writes go through one lock, so frames reach the subscriber in the order {@link #offer(Object)} was
 * called. The buffer is bounded: once it is full, {@code offer} blocks until the subscriber requests more or
 * cancels. Delivery to the subscriber happens outside the lock and is never concurrent.
 *
 * <p>The first subscription triggers the {@link #onStart(Runnable)} action; cancellation triggers the
 * {@link #onCancel(Runnable)} action. Both must be set before the publisher is handed out.
 *
 * @param <T> frame type
 */
public final class FramePublisher<T> implements Flow.Publisher<T> {

    private final int capacity;
    private volatile Runnable onStart = () -> { };
    private volatile Runnable onCancel = () -> { };

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition spaceAvailable = lock.newCondition();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();

    private Flow.Subscriber<? super T> subscriber;
    private long demand;
    private boolean draining;
    private boolean completing;
    private Throwable failure;
    private boolean terminated;
    private boolean cancelled;

    public FramePublisher(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    public FramePublisher<T> onStart(Runnable action) {
        this.onStart = Objects.requireNonNull(action, "action");
        return this;
    }

    public FramePublisher<T> onCancel(Runnable action) {
        this.onCancel = Objects.requireNonNull(action, "action");
        return this;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super T> s) {
        Objects.requireNonNull(s, "subscriber");
        lock.lock();
        try {
            if (subscriber != null) {
                s.onSubscribe(new Flow.Subscription() {
                    @Override
                    public void request(long n) {}

                    @Override
                    public void cancel() {}
                });
                s.onError(new IllegalStateException("frame publisher allows a single subscriber"));
                return;
            }
            subscriber = s;
        } finally {
            lock.unlock();
        }
        s.onSubscribe(new Subscription());
        onStart.run();
    }

    /**
     * Queues a frame, blocking while the buffer is full.
     *
     * @return {@code false} if the frame was dropped because the stream is cancelled or already completing
     */
    public boolean offer(T frame) {
        Objects.requireNonNull(frame, "frame");
        lock.lock();
        try {
            while (buffer.size() >= capacity && !cancelled && !completing) {
                spaceAvailable.await();
            }
            if (cancelled || completing) return false;
            buffer.addLast(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
        drain();
        return true;
    }

    /**
     * Completes the stream once every buffered frame has been delivered.
     */
    public void complete() {
        terminate(null);
    }

    /**
     * Fails the stream once every buffered frame has been delivered.
     */
    public void fail(Throwable error) {
        terminate(Objects.requireNonNull(error, "error"));
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    private void terminate(Throwable error) {
        lock.lock();
        try {
            if (completing) return;
            completing = true;
            failure = error;
            spaceAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        drain();
    }

    private void drain() {
        lock.lock();
        try {
            if (draining || subscriber == null) return;
            draining = true;
        } finally {
            lock.unlock();
        }

        while (true) {
            T next = null;
            Throwable error = null;
            boolean finish = false;
            Flow.Subscriber<? super T> target;

            lock.lock();
            try {
                target = subscriber;
                if (cancelled || terminated) {
                    draining = false;
                    return;
                }
                if (demand > 0 && !buffer.isEmpty()) {
                    next = buffer.pollFirst();
                    demand--;
                    spaceAvailable.signalAll();
                } else if (buffer.isEmpty() && completing) {
                    terminated = true;
                    finish = true;
                    error = failure;
                } else {
                    draining = false;
                    return;
                }
            } finally {
                lock.unlock();
            }

            if (finish) {
                if (error != null) {
                    target.onError(error);
                } else {
                    target.onComplete();
                }
                lock.lock();
                try {
                    draining = false;
                } finally {
                    lock.unlock();
                }
                return;
            }
            target.onNext(next);
        }
    }

    private final class Subscription implements Flow.Subscription {
        @Override
        public void request(long n) {
            if (n <= 0) {
                cancel();
                subscriber.onError(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            lock.lock();
            try {
                long next = demand + n;
                demand = next < 0 ? Long.MAX_VALUE : next;
            } finally {
                lock.unlock();
            }
            drain();
        }

        @Override
        public void cancel() {
            lock.lock();
            try {
                if (cancelled || terminated) return;
                cancelled = true;
                buffer.clear();
                spaceAvailable.signalAll();
            } finally {
                lock.unlock();
            }
            onCancel.run();
        }
    }
}
