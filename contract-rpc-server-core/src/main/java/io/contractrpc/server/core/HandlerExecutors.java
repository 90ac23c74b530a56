package io.contractrpc.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default executor for stream handlers, which block for as long as their connection stays open.
 */
final class HandlerExecutors {

    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerExecutors.class);

    private HandlerExecutors() {}

    /**
     * One virtual thread per handler on runtimes that have them, otherwise a cached pool of daemon threads
     * named {@code <prefix>-<n>}.
     */
    static ExecutorService newExecutor(String prefix) {
        try {
            ExecutorService virtual = (ExecutorService) Executors.class
                    .getMethod("newVirtualThreadPerTaskExecutor")
                    .invoke(null);
            LOGGER.debug("Running stream handlers on virtual threads");
            return virtual;
        } catch (ReflectiveOperationException e) {
            LOGGER.debug("Virtual threads unavailable, running stream handlers on a cached pool");
        }
        AtomicInteger ids = new AtomicInteger();
        return Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, prefix + "-" + ids.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
