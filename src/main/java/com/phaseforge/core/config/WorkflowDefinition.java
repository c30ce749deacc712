package com.phaseforge.core.config;

import com.phaseforge.core.model.PhaseSpec;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.RetryPolicy;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable workflow: the phase ordering, the resolved workers and the retry policy.
 */
public record WorkflowDefinition(
        Path projectRoot,
        List<PhaseSpec> phases,
        Map<String, WorkerSpec> workers,
        RetryPolicy retryPolicy
) {

    public WorkflowDefinition {
        phases = List.copyOf(phases);
        workers = Collections.unmodifiableMap(new LinkedHashMap<>(workers));
    }

    public List<PhaseSpec> enabledPhases() {
        return phases.stream().filter(PhaseSpec::enabled).toList();
    }

    /** The first enabled phase, or null when every phase is disabled. */
    public String firstEnabledPhase() {
        return phases.stream().filter(PhaseSpec::enabled).map(PhaseSpec::name).findFirst().orElse(null);
    }

    /** The next enabled phase after {@code current}, or null when {@code current} is the last. */
    public String nextEnabledPhase(String current) {
        int index = indexOf(current);
        for (int i = index + 1; i < phases.size(); i++) {
            if (phases.get(i).enabled()) {
                return phases.get(i).name();
            }
        }
        return null;
    }

    public PhaseSpec phase(String name) {
        return phases.get(indexOf(name));
    }

    public WorkerSpec worker(String id) {
        WorkerSpec spec = workers.get(id);
        if (spec == null) {
            throw new WorkflowConfigurationException("Unknown worker '" + id + "'");
        }
        return spec;
    }

    private int indexOf(String phaseName) {
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).name().equals(phaseName)) {
                return i;
            }
        }
        throw new WorkflowConfigurationException("Unknown phase '" + phaseName + "'");
    }
}
