package com.phaseforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of checking a phase's declared artifacts.
 */
public enum ValidationStatus {
    @JsonProperty("pass") PASS,
    @JsonProperty("partial") PARTIAL,
    @JsonProperty("fail") FAIL;

    public String wireName() {
        return name().toLowerCase();
    }
}
