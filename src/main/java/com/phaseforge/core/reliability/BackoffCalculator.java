package com.phaseforge.core.reliability;

import java.util.Random;

/**
 * Computes retry delays: {@code baseDelay * multiplier^(n-1)}, perturbed by a uniform value in
 * {@code [-jitter, +jitter] * delay} and floored at zero.
 * <p>
 * The random source is injected so tests can seed it.
 */
public class BackoffCalculator {

    private final Random random;

    public BackoffCalculator(Random random) {
        this.random = random;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay in milliseconds before the next attempt
     */
    public long delayMillis(int failedAttempt, RetryPolicy policy) {
        double nominal = nominalDelayMillis(failedAttempt, policy);
        double offset = nominal * policy.jitter() * (2.0 * random.nextDouble() - 1.0);
        return Math.round(Math.max(0.0, nominal + offset));
    }

    /** The delay before jitter is applied. */
    public double nominalDelayMillis(int failedAttempt, RetryPolicy policy) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got " + failedAttempt);
        }
        return policy.baseDelay().toMillis() * Math.pow(policy.backoffMultiplier(), failedAttempt - 1);
    }
}
