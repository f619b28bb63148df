package com.paxkun.pulldb.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AutoCloseableExecutor wraps the ExecutorService used for fan-out reads so it can be closed
 * by try-with-resources in tests and by Spring on context shutdown.
 *
 * Usage Example:
 * <pre>
 * try (AutoCloseableExecutor executor = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), 5)) {
 *     FanOut fanOut = new FanOut(executor);
 *     ...
 * }
 * </pre>
 *
 * Author: Pax
 */
@Slf4j
public record AutoCloseableExecutor(ExecutorService executor, long shutdownSeconds) implements AutoCloseable {

    public AutoCloseableExecutor(ExecutorService executor) {
        this(executor, 30);
    }

    /**
     * Stops accepting work and waits up to {@code shutdownSeconds} for in-flight reads,
     * then interrupts whatever is left.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownSeconds, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("⚠️ Fan-out executor did not terminate within {}s, forced shutdown.", shutdownSeconds);
            } else {
                log.info("✅ Fan-out executor shutdown cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.error("❌ Fan-out executor shutdown interrupted: {}", e.getMessage(), e);
        }
    }
}
