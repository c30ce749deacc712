package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of validating a phase's required artifact patterns.
 *
 * @param required     the patterns that were checked, in declaration order
 * @param found        patterns that matched at least one non-empty file
 * @param missing      patterns that matched nothing usable
 * @param matchedFiles every non-empty file matched by any pattern, sorted, relative to the root
 */
public record ValidationResult(
        @JsonProperty("status") ValidationStatus status,
        @JsonProperty("required") List<String> required,
        @JsonProperty("found") List<String> found,
        @JsonProperty("missing") List<String> missing,
        @JsonProperty("matched_files") List<String> matchedFiles
) {

    public ValidationResult {
        required = required != null ? List.copyOf(required) : List.of();
        found = found != null ? List.copyOf(found) : List.of();
        missing = missing != null ? List.copyOf(missing) : List.of();
        matchedFiles = matchedFiles != null ? List.copyOf(matchedFiles) : List.of();
    }

    public boolean passed() {
        return status == ValidationStatus.PASS;
    }
}
