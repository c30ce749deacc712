package com.phaseforge.core.model;

import java.util.List;

/**
 * One named step of the workflow and the workers that carry it out.
 *
 * @param name              unique phase name
 * @param workers           worker ids, in execution order
 * @param parallel          run the workers concurrently instead of in order
 * @param maxConcurrency    upper bound on concurrently running workers when parallel
 * @param requiresApproval  suspend after a successful attempt until approved
 * @param requiredArtifacts glob patterns, relative to the project root
 * @param failFast          stop a sequential phase at the first failed worker
 * @param enabled           disabled phases are skipped by the phase ordering
 */
public record PhaseSpec(
        String name,
        List<String> workers,
        boolean parallel,
        int maxConcurrency,
        boolean requiresApproval,
        List<String> requiredArtifacts,
        boolean failFast,
        boolean enabled
) {

    public PhaseSpec {
        workers = workers != null ? List.copyOf(workers) : List.of();
        requiredArtifacts = requiredArtifacts != null ? List.copyOf(requiredArtifacts) : List.of();
        if (maxConcurrency < 1) {
            maxConcurrency = 1;
        }
    }

    public static PhaseSpec sequential(String name, List<String> workers, List<String> requiredArtifacts) {
        return new PhaseSpec(name, workers, false, 1, false, requiredArtifacts, false, true);
    }
}
