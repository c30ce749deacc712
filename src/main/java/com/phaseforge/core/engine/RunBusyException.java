package com.phaseforge.core.engine;

import com.phaseforge.core.PipelineException;

/**
 * Another operation is already in progress on the same run.
 */
public class RunBusyException extends PipelineException {

    public RunBusyException(String runId) {
        super("Run " + runId + " is busy with another operation");
    }
}
