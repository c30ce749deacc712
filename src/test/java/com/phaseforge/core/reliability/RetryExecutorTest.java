package com.phaseforge.core.reliability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private RetryExecutor executor;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        executor = new RetryExecutor(new BackoffCalculator(new Random(5)), sleeps::add);
        policy = new RetryPolicy(2, Duration.ofMillis(100), 2.0, 0.0, Set.of(75), List.of("rate limit"));
    }

    @Test
    @DisplayName("returns the first successful result without sleeping")
    void succeedsFirstTime() throws Exception {
        String result = executor.execute(attempt -> "ok-" + attempt, policy, e -> true);

        assertEquals("ok-1", result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("retries retryable failures and backs off exponentially")
    void retriesWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "done on " + attempt;
        }, policy, e -> true);

        assertEquals("done on 3", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    @DisplayName("makes at most maxRetries + 1 attempts and rethrows the last error unchanged")
    void rethrowsLastErrorUnchanged() {
        AtomicInteger calls = new AtomicInteger();
        List<IllegalStateException> thrown = new ArrayList<>();

        var error = assertThrows(IllegalStateException.class, () -> executor.execute(attempt -> {
            calls.incrementAndGet();
            var e = new IllegalStateException("attempt " + attempt);
            thrown.add(e);
            throw e;
        }, policy, e -> true));

        assertEquals(3, calls.get());
        assertSame(thrown.get(2), error);
        assertEquals("attempt 3", error.getMessage());
    }

    @Test
    @DisplayName("does not retry when the error is not retryable")
    void stopsOnNonRetryableError() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> executor.execute(attempt -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        }, policy, e -> !(e instanceof IllegalArgumentException)));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("a policy without retries makes exactly one attempt")
    void noRetriesPolicy() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IOException.class, () -> executor.execute(attempt -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }, RetryPolicy.none(), e -> true));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("interruption while sleeping stops the retry loop")
    void interruptedSleepStops() {
        var interrupting = new RetryExecutor(new BackoffCalculator(new Random(1)), millis -> {
            throw new InterruptedException("stop");
        });

        assertThrows(InterruptedException.class, () -> interrupting.execute(attempt -> {
            throw new IOException("flaky");
        }, policy, e -> true));
        assertTrue(Thread.interrupted(), "interrupt flag should be restored");
    }
}
