package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkerMetrics(
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("exit_code") int exitCode,
        @JsonProperty("retry_count") int retryCount
) {
}
