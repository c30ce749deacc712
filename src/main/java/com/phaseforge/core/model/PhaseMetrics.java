package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timing and outcome of the most recent finished attempt at a phase.
 *
 * @param attempts how many times the phase has been executed in this run
 * @param workers  per-worker figures, keyed by worker id
 */
public record PhaseMetrics(
        @JsonProperty("phase") String phase,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("workers") Map<String, WorkerMetrics> workers,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("artifact_count") int artifactCount
) {

    public PhaseMetrics {
        workers = workers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(workers))
                : Map.of();
    }

    public int retries() {
        return workers.values().stream().mapToInt(WorkerMetrics::retryCount).sum();
    }

    public long failedWorkers() {
        return workers.values().stream().filter(w -> w.exitCode() != 0).count();
    }
}
