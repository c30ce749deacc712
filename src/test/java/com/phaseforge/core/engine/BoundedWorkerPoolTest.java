package com.phaseforge.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedWorkerPoolTest {

    @Test
    @DisplayName("never runs more tasks at once than the bound")
    void respectsBound() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            int n = i;
            tasks.add(() -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(30);
                running.decrementAndGet();
                return n;
            });
        }

        try (BoundedWorkerPool pool = new BoundedWorkerPool(3, "test-")) {
            List<Integer> results = pool.runAll(tasks, (index, error) -> -1);

            assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
            assertEquals(12, results.size());
        }
    }

    @Test
    @DisplayName("results come back in submission order")
    void preservesOrder() {
        List<Callable<String>> tasks = List.of(
                () -> { Thread.sleep(60); return "slow"; },
                () -> "fast",
                () -> { Thread.sleep(20); return "medium"; });

        try (BoundedWorkerPool pool = new BoundedWorkerPool(3, "test-")) {
            assertEquals(List.of("slow", "fast", "medium"), pool.runAll(tasks, (index, error) -> "failed"));
        }
    }

    @Test
    @DisplayName("a failing task is mapped without losing the others")
    void failureIsolated() {
        List<Callable<String>> tasks = List.of(
                () -> "a",
                () -> { throw new IllegalStateException("broken"); },
                () -> "c");

        try (BoundedWorkerPool pool = new BoundedWorkerPool(2, "test-")) {
            List<String> results = pool.runAll(tasks, (index, error) -> "failed " + index + ": " + error.getMessage());
            assertEquals(List.of("a", "failed 1: broken", "c"), results);
        }
    }

    @Test
    void rejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedWorkerPool(0, "test-"));
    }
}
