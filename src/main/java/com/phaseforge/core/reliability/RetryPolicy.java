package com.phaseforge.core.reliability;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Retry parameters for worker invocations.
 *
 * @param maxRetries          retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param baseDelay           delay before the first retry, before jitter
 * @param backoffMultiplier   growth factor applied per further retry
 * @param jitter              fraction of the delay added or removed at random, in [0, 1]
 * @param transientExitCodes  exit codes (or HTTP statuses for remote workers) worth retrying
 * @param transientMessages   lower-case substrings of failure text worth retrying
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        double backoffMultiplier,
        double jitter,
        Set<Integer> transientExitCodes,
        List<String> transientMessages
) {

    public static final Set<Integer> DEFAULT_TRANSIENT_EXIT_CODES =
            Set.of(75, 101, 111, 125, 429, 502, 503, 504);
    public static final List<String> DEFAULT_TRANSIENT_MESSAGES =
            List.of("rate limit", "transient network", "timeout");

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got " + jitter);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
        }
        baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        transientExitCodes = transientExitCodes != null ? Set.copyOf(transientExitCodes) : Set.of();
        transientMessages = transientMessages != null
                ? transientMessages.stream().map(String::toLowerCase).toList()
                : List.of();
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(2, Duration.ofMillis(700), 2.0, 0.25,
                DEFAULT_TRANSIENT_EXIT_CODES, DEFAULT_TRANSIENT_MESSAGES);
    }

    /** A policy that makes exactly one attempt. */
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, 1.0, 0.0, Set.of(), List.of());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
