package com.phaseforge.core.reliability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an operation against a deadline.
 * <p>
 * The operation executes on a guard thread while the caller waits. When the deadline passes the
 * guard thread is interrupted and the caller receives {@link TimeoutExceededException}; operations
 * that spawn processes are expected to tear them down on interrupt.
 */
public class TimeoutGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ExecutorService executor;

    public TimeoutGuard() {
        this(Executors.newCachedThreadPool(daemonThreads("phaseforge-timeout-")));
    }

    public TimeoutGuard(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code operation}, failing with {@link TimeoutExceededException} after {@code timeout}.
     * A null or non-positive timeout runs the operation directly on the calling thread.
     * Exceptions thrown by the operation propagate unchanged.
     */
    public <T> T withTimeout(Callable<T> operation, Duration timeout) throws Exception {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return operation.call();
        }

        Future<T> future = executor.submit(operation);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation exceeded timeout of {}ms, cancelled", timeout.toMillis());
            throw new TimeoutExceededException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
