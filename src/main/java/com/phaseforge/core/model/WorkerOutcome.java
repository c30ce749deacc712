package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phaseforge.core.reliability.ErrorKind;

import java.util.List;

/**
 * Result of invoking one worker for one phase, after all retry attempts.
 *
 * @param notes       tail of the worker's output, truncated
 * @param retryCount  attempts beyond the first
 * @param failureKind classification of the last failure; null on success
 */
public record WorkerOutcome(
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("success") boolean success,
        @JsonProperty("artifacts") List<String> artifacts,
        @JsonProperty("notes") String notes,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("exit_code") int exitCode,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("failure_kind") ErrorKind failureKind
) {

    public static final int MAX_NOTES_CHARS = 500;

    public WorkerOutcome {
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        notes = truncateNotes(notes);
    }

    public static WorkerOutcome succeeded(String workerId, List<String> artifacts, String notes,
                                          long durationMs) {
        return new WorkerOutcome(workerId, true, artifacts, notes, List.of(), 0, durationMs, 0, null);
    }

    public static WorkerOutcome failed(String workerId, int exitCode, String error, String notes,
                                       long durationMs, ErrorKind kind) {
        return new WorkerOutcome(workerId, false, List.of(), notes, List.of(error), exitCode,
                durationMs, 0, kind);
    }

    public WorkerOutcome withRetryCount(int retries) {
        return new WorkerOutcome(workerId, success, artifacts, notes, errors, exitCode,
                durationMs, retries, failureKind);
    }

    public WorkerOutcome withDuration(long totalMs) {
        return new WorkerOutcome(workerId, success, artifacts, notes, errors, exitCode,
                totalMs, retryCount, failureKind);
    }

    /** Keeps the end of the text, where failures usually surface. */
    static String truncateNotes(String notes) {
        if (notes == null) {
            return "";
        }
        String trimmed = notes.strip();
        if (trimmed.length() <= MAX_NOTES_CHARS) {
            return trimmed;
        }
        return "..." + trimmed.substring(trimmed.length() - MAX_NOTES_CHARS);
    }
}
