package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle states of a workflow run.
 */
public enum RunStatus {
    @JsonProperty("idle") IDLE,
    @JsonProperty("running") RUNNING,
    @JsonProperty("awaiting_approval") AWAITING_APPROVAL,
    @JsonProperty("needs_revision") NEEDS_REVISION,
    @JsonProperty("completed") COMPLETED;

    /** True when a human has to act before the run can continue. */
    public boolean needsAttention() {
        return this == AWAITING_APPROVAL || this == NEEDS_REVISION;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
