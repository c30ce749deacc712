package com.phaseforge.core.metrics;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.ValidationStatus;

import java.util.Collection;

/**
 * Scores how cleanly a run went, from 100 down to 0.
 * <p>
 * Each retry costs 2 points, each failed worker 10, each partial validation 5 and each failed
 * validation 15, counted over the latest attempt of every finished phase plus all retries.
 */
public final class HygieneScorer {

    static final int RETRY_PENALTY = 2;
    static final int FAILED_WORKER_PENALTY = 10;
    static final int PARTIAL_VALIDATION_PENALTY = 5;
    static final int FAILED_VALIDATION_PENALTY = 15;

    private HygieneScorer() {}

    public static int score(Collection<PhaseMetrics> phases, int totalRetries) {
        long penalty = (long) totalRetries * RETRY_PENALTY;
        for (PhaseMetrics phase : phases) {
            penalty += phase.failedWorkers() * FAILED_WORKER_PENALTY;
            if (phase.validationStatus() == ValidationStatus.PARTIAL) {
                penalty += PARTIAL_VALIDATION_PENALTY;
            } else if (phase.validationStatus() == ValidationStatus.FAIL) {
                penalty += FAILED_VALIDATION_PENALTY;
            }
        }
        return (int) Math.max(0, 100 - penalty);
    }
}
