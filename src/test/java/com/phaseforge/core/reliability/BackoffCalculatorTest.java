package com.phaseforge.core.reliability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    private static RetryPolicy policy(long baseMs, double multiplier, double jitter) {
        return new RetryPolicy(5, Duration.ofMillis(baseMs), multiplier, jitter, Set.of(), List.of());
    }

    @Test
    @DisplayName("nominal delay grows by the multiplier per failed attempt")
    void nominalDelayIsExponential() {
        var calculator = new BackoffCalculator(new Random(1));
        var policy = policy(700, 2.0, 0.25);

        assertEquals(700.0, calculator.nominalDelayMillis(1, policy));
        assertEquals(1400.0, calculator.nominalDelayMillis(2, policy));
        assertEquals(2800.0, calculator.nominalDelayMillis(3, policy));
    }

    @Test
    @DisplayName("jittered delay stays within +/- jitter of the nominal delay")
    void jitteredDelayWithinBounds() {
        var calculator = new BackoffCalculator(new Random(42));
        var policy = policy(1000, 2.0, 0.25);

        for (int attempt = 1; attempt <= 4; attempt++) {
            double nominal = calculator.nominalDelayMillis(attempt, policy);
            for (int i = 0; i < 500; i++) {
                long delay = calculator.delayMillis(attempt, policy);
                assertTrue(delay >= Math.floor(nominal * 0.75), "delay " + delay + " below bound for attempt " + attempt);
                assertTrue(delay <= Math.ceil(nominal * 1.25), "delay " + delay + " above bound for attempt " + attempt);
            }
        }
    }

    @Test
    @DisplayName("zero jitter yields exactly the nominal delay")
    void zeroJitterIsExact() {
        var calculator = new BackoffCalculator(new Random(7));
        var policy = policy(250, 3.0, 0.0);

        assertEquals(250, calculator.delayMillis(1, policy));
        assertEquals(750, calculator.delayMillis(2, policy));
        assertEquals(2250, calculator.delayMillis(3, policy));
    }

    @Test
    @DisplayName("full jitter never produces a negative delay")
    void delayIsFlooredAtZero() {
        var calculator = new BackoffCalculator(new Random(3));
        var policy = policy(100, 1.0, 1.0);

        for (int i = 0; i < 1000; i++) {
            long delay = calculator.delayMillis(1, policy);
            assertTrue(delay >= 0);
            assertTrue(delay <= 200);
        }
    }

    @Test
    @DisplayName("same seed gives the same delay sequence")
    void seededSequenceIsReproducible() {
        var policy = RetryPolicy.defaults();
        var first = new BackoffCalculator(new Random(99));
        var second = new BackoffCalculator(new Random(99));

        for (int attempt = 1; attempt <= 3; attempt++) {
            assertEquals(first.delayMillis(attempt, policy), second.delayMillis(attempt, policy));
        }
    }

    @Test
    @DisplayName("attempt numbers start at 1")
    void rejectsAttemptZero() {
        var calculator = new BackoffCalculator(new Random());
        assertThrows(IllegalArgumentException.class,
                () -> calculator.delayMillis(0, RetryPolicy.defaults()));
    }
}
