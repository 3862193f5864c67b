package com.acme.inventory.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of named worker threads. The submitting thread's MDC is copied into each task,
 * so log lines written by a worker keep the caller's correlation keys.
 */
public class BoundedWorkerPool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BoundedWorkerPool.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final String name;
    private final ExecutorService executor;

    public BoundedWorkerPool(String name, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("pool size must be positive (current: " + size + ")");
        }
        this.name = name;
        this.executor = Executors.newFixedThreadPool(size, new NamedThreadFactory(name));
    }

    public <T> Future<T> submit(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return executor.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Pool {} did not drain within {}s, forcing shutdown", name, SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
