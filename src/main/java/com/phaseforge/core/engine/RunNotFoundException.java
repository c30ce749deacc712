package com.phaseforge.core.engine;

import com.phaseforge.core.PipelineException;

public class RunNotFoundException extends PipelineException {

    public RunNotFoundException(String runId) {
        super(runId == null ? "No runs found" : "Run not found: " + runId);
    }
}
