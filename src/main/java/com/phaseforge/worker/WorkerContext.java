package com.phaseforge.worker;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What a worker gets to know about the run it is working for.
 *
 * @param priorArtifacts artifacts recorded for earlier phases, keyed by phase name
 * @param metadata       parameters the run was started with
 */
public record WorkerContext(
        String runId,
        String phase,
        Path projectRoot,
        Map<String, List<String>> priorArtifacts,
        Map<String, String> metadata
) {

    public WorkerContext {
        priorArtifacts = priorArtifacts != null ? Map.copyOf(priorArtifacts) : Map.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
