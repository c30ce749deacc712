package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * What happened during one attempt at a phase.
 *
 * @param approvalPackagePath project-relative path of the approval request, when one was written
 */
public record PhaseOutcome(
        @JsonProperty("phase") String phaseName,
        @JsonProperty("success") boolean success,
        @JsonProperty("workers") List<WorkerOutcome> workerOutcomes,
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("requires_approval") boolean requiresApproval,
        @JsonProperty("awaiting_approval") boolean awaitingApproval,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("approval_package") String approvalPackagePath
) {

    public PhaseOutcome {
        workerOutcomes = workerOutcomes != null ? List.copyOf(workerOutcomes) : List.of();
    }

    public boolean allWorkersSucceeded() {
        return workerOutcomes.stream().allMatch(WorkerOutcome::success);
    }

    public List<String> errors() {
        return workerOutcomes.stream()
                .flatMap(w -> w.errors().stream().map(e -> w.workerId() + ": " + e))
                .toList();
    }

    public int totalRetries() {
        return workerOutcomes.stream().mapToInt(WorkerOutcome::retryCount).sum();
    }

    public PhaseOutcome withApprovalPackage(String path) {
        return new PhaseOutcome(phaseName, success, workerOutcomes, validation, requiresApproval,
                awaitingApproval, completedAt, path);
    }
}
