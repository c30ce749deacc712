package com.phaseforge.core.reliability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Re-runs an operation with exponential backoff while its failures are retryable.
 * <p>
 * At most {@code policy.maxRetries() + 1} attempts are made. The error of the last attempt is
 * rethrown unchanged, so callers see exactly what the operation raised.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /** One attempt of a retried operation. */
    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param attempt 1-based attempt number
         */
        T call(int attempt) throws Exception;
    }

    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public RetryExecutor(BackoffCalculator backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public <T> T execute(Attempt<T> operation, RetryPolicy policy,
                         Predicate<Throwable> isRetryable) throws Exception {
        int maxAttempts = policy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (attempt >= maxAttempts || !isRetryable.test(e)) {
                    if (attempt > 1) {
                        log.warn("Giving up after {} attempt(s): {}", attempt, e.getMessage());
                    }
                    throw e;
                }
                long delay = backoff.delayMillis(attempt, policy);
                log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), delay);
                pause(delay);
            }
        }
    }

    private void pause(long delay) throws InterruptedException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
