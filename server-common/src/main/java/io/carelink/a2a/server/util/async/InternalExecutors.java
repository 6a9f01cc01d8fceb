package io.carelink.a2a.server.util.async;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.carelink.a2a.server.config.A2AConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the pool that runs agent executors and streaming stages.
 */
public final class InternalExecutors {

    private static final Logger LOGGER = LoggerFactory.getLogger(InternalExecutors.class);

    public static final String CORE_POOL_SIZE = "a2a.executor.core-pool-size";
    public static final String MAX_POOL_SIZE = "a2a.executor.max-pool-size";
    public static final String KEEP_ALIVE_SECONDS = "a2a.executor.keep-alive-seconds";

    private InternalExecutors() {
    }

    /**
     * Creates a pool sized from the {@code a2a.executor.*} settings. Threads are daemon threads
     * named {@code <name>-<n>}. The queue is bounded by the maximum pool size; work submitted
     * while both are full is rejected with a {@link java.util.concurrent.RejectedExecutionException}
     * and never runs on the submitting thread, which may be an event loop.
     *
     * @param name the thread name prefix
     * @param config the settings
     * @return the pool
     */
    public static ExecutorService create(String name, A2AConfigProvider config) {
        int coreSize = config.getIntValue(CORE_POOL_SIZE);
        int maxSize = config.getIntValue(MAX_POOL_SIZE);
        long keepAlive = config.getLongValue(KEEP_ALIVE_SECONDS);
        if (coreSize < 0 || maxSize < 1 || maxSize < coreSize) {
            throw new IllegalArgumentException("Invalid executor pool sizes: core=" + coreSize + ", max=" + maxSize);
        }
        LOGGER.debug("Creating {} executor: core={}, max={}, keepAlive={}s", name, coreSize, maxSize, keepAlive);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAlive,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(maxSize),
                new NamedThreadFactory(name),
                new ThreadPoolExecutor.AbortPolicy());
        if (keepAlive > 0) {
            executor.allowCoreThreadTimeOut(true);
        }
        return executor;
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
