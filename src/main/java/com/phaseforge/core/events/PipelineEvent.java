package com.phaseforge.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A notable step in a run's life, e.g. {@code phase.started} or {@code run.completed}.
 *
 * @param phase null for run-level events
 */
public record PipelineEvent(
        String eventType,
        String runId,
        String phase,
        Map<String, Object> payload,
        Instant timestamp
) {

    public PipelineEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
