package com.phaseforge.core.metrics;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.ValidationStatus;
import com.phaseforge.core.model.WorkerMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HygieneScorerTest {

    private static PhaseMetrics phase(ValidationStatus status, Map<String, WorkerMetrics> workers) {
        return new PhaseMetrics("p", null, null, 0.0, 1, workers, status, 0);
    }

    @Test
    @DisplayName("a clean run scores 100")
    void clean() {
        assertEquals(100, HygieneScorer.score(List.of(phase(ValidationStatus.PASS, Map.of())), 0));
    }

    @Test
    @DisplayName("retries, failed workers and validation outcomes all cost points")
    void penalties() {
        var failedWorker = Map.of("w", new WorkerMetrics(1.0, 3, 0));
        var phases = List.of(
                phase(ValidationStatus.PARTIAL, Map.of()),
                phase(ValidationStatus.FAIL, failedWorker));

        // 100 - 3*2 - 5 - 15 - 10
        assertEquals(64, HygieneScorer.score(phases, 3));
    }

    @Test
    @DisplayName("never drops below zero")
    void floored() {
        assertEquals(0, HygieneScorer.score(List.of(phase(ValidationStatus.FAIL, Map.of())), 500));
    }
}
