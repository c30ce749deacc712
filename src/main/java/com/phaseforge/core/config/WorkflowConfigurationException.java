package com.phaseforge.core.config;

import com.phaseforge.core.PipelineException;

import java.util.List;

/**
 * The workflow configuration is unusable. Carries every problem found, not just the first.
 */
public class WorkflowConfigurationException extends PipelineException {

    private final List<String> problems;

    public WorkflowConfigurationException(String message) {
        this(List.of(message));
    }

    public WorkflowConfigurationException(List<String> problems) {
        super("Invalid workflow configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
