package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent state of a single workflow run.
 * <p>
 * Instances are immutable. Every transition produces a new value through one of the
 * {@code with*} methods; the engine swaps it in only after the snapshot has been written.
 * {@code currentPhase} is null only once the run is {@link RunStatus#COMPLETED}.
 */
public record RunState(
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("current_phase") String currentPhase,
        @JsonProperty("completed_phases") List<String> completedPhases,
        @JsonProperty("phase_artifacts") Map<String, List<String>> phaseArtifacts,
        @JsonProperty("awaiting_approval") boolean awaitingApproval,
        @JsonProperty("approval_phase") String approvalPhase,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("errors") List<String> errors
) implements Serializable {

    public RunState {
        completedPhases = completedPhases != null ? List.copyOf(completedPhases) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        phaseArtifacts = copyArtifacts(phaseArtifacts);
    }

    /**
     * Creates the state of a freshly started run, positioned on its first phase.
     */
    public static RunState started(String runId, String firstPhase, Map<String, String> metadata, Instant now) {
        return new RunState(runId, RunStatus.RUNNING, now, now, firstPhase,
                List.of(), Map.of(), false, null, metadata, List.of());
    }

    public RunState withStatus(RunStatus newStatus, Instant now) {
        return new RunState(runId, newStatus, createdAt, now, currentPhase, completedPhases,
                phaseArtifacts, awaitingApproval, approvalPhase, metadata, errors);
    }

    public RunState withError(String error, Instant now) {
        List<String> updated = new ArrayList<>(errors);
        updated.add(error);
        return new RunState(runId, status, createdAt, now, currentPhase, completedPhases,
                phaseArtifacts, awaitingApproval, approvalPhase, metadata, updated);
    }

    public RunState withErrors(List<String> newErrors, Instant now) {
        List<String> updated = new ArrayList<>(errors);
        updated.addAll(newErrors);
        return new RunState(runId, status, createdAt, now, currentPhase, completedPhases,
                phaseArtifacts, awaitingApproval, approvalPhase, metadata, updated);
    }

    public RunState withPhaseArtifacts(String phase, List<String> artifacts, Instant now) {
        Map<String, List<String>> updated = new LinkedHashMap<>(phaseArtifacts);
        updated.put(phase, artifacts);
        return new RunState(runId, status, createdAt, now, currentPhase, completedPhases,
                updated, awaitingApproval, approvalPhase, metadata, errors);
    }

    public RunState withApprovalPending(String phase, Instant now) {
        return new RunState(runId, RunStatus.AWAITING_APPROVAL, createdAt, now, currentPhase,
                completedPhases, phaseArtifacts, true, phase, metadata, errors);
    }

    public RunState withApprovalCleared(Instant now) {
        return new RunState(runId, status, createdAt, now, currentPhase, completedPhases,
                phaseArtifacts, false, null, metadata, errors);
    }

    /**
     * Marks {@code currentPhase} complete and moves the cursor to {@code nextPhase}.
     * A null next phase completes the run.
     */
    public RunState withPhaseCompleted(String nextPhase, Instant now) {
        List<String> completed = new ArrayList<>(completedPhases);
        if (currentPhase != null && !completed.contains(currentPhase)) {
            completed.add(currentPhase);
        }
        RunStatus next = nextPhase == null ? RunStatus.COMPLETED : RunStatus.RUNNING;
        return new RunState(runId, next, createdAt, now, nextPhase, completed,
                phaseArtifacts, false, null, metadata, errors);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    private static Map<String, List<String>> copyArtifacts(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((phase, paths) -> copy.put(phase, paths != null ? List.copyOf(paths) : List.of()));
        return Collections.unmodifiableMap(copy);
    }
}
