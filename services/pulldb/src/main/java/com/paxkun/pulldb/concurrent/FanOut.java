package com.paxkun.pulldb.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fan-out/fan-in over the shared read pool: launch every task, wait for all of them,
 * then either return the results in input order or rethrow the first failure.
 * Tasks handed to this class must not fan out again themselves; the pool is bounded.
 *
 * Author: Pax
 */
public class FanOut {

    private final AutoCloseableExecutor executor;

    public FanOut(AutoCloseableExecutor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor.executor());
    }

    /**
     * Applies {@code task} to every item concurrently. Results keep the order of {@code items}.
     */
    public <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> task) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<? extends R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(item), executor.executor()));
        }
        awaitAll(futures);
        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<? extends R> future : futures) {
            results.add(join(future));
        }
        return results;
    }

    /**
     * Blocks until every future has finished, successfully or not, so no task outlives the call.
     * Failures are left on the futures for {@link #join} to report.
     */
    public void awaitAll(List<? extends CompletableFuture<?>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(failure -> null)
                .join();
    }

    /**
     * Returns the value of a completed (or completing) future, rethrowing its failure unwrapped.
     */
    public <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Concurrent read failed: " + cause.getMessage(), cause);
        }
    }
}
