package com.phaseforge.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Fixed-size pool for running one parallel phase.
 * <p>
 * At most {@code maxConcurrency} tasks run at once; the rest wait in an unbounded queue in
 * submission order. Results come back in submission order regardless of completion order.
 */
public class BoundedWorkerPool implements AutoCloseable {

    private final ThreadPoolExecutor executor;
    private final int maxConcurrency;

    public BoundedWorkerPool(int maxConcurrency, String threadNamePrefix) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(maxConcurrency, maxConcurrency,
                0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, threadNamePrefix + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Runs every task and waits for all of them.
     *
     * @param onFailure maps a task's index and thrown exception to a result, so one failing task
     *                  never loses the results of the others
     */
    public <T> List<T> runAll(List<Callable<T>> tasks, BiFunction<Integer, Throwable, T> onFailure) {
        List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return task.call();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }

        List<T> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                results.add(onFailure.apply(i, cause));
            }
        }
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
