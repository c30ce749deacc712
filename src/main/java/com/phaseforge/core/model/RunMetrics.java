package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metrics for a whole run. Both the JSON record and the Prometheus exposition are rendered
 * from this value.
 *
 * @param phases       finished phases keyed by name, in the order they first finished
 * @param totalRetries retries across every phase attempt of the run
 * @param hygieneScore 0..100, lower means more retries and failures along the way
 * @param status       run status at the time of the snapshot
 */
public record RunMetrics(
        @JsonProperty("run_id") String runId,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("phases") Map<String, PhaseMetrics> phases,
        @JsonProperty("total_retries") int totalRetries,
        @JsonProperty("hygiene_score") int hygieneScore,
        @JsonProperty("status") String status
) {

    public RunMetrics {
        phases = phases != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(phases))
                : Map.of();
    }

    public static RunMetrics empty(String runId, Instant startedAt) {
        return new RunMetrics(runId, startedAt, null, 0.0, Map.of(), 0, 100, RunStatus.RUNNING.wireName());
    }

    public double totalPhaseSeconds() {
        return phases.values().stream().mapToDouble(PhaseMetrics::durationSeconds).sum();
    }
}
