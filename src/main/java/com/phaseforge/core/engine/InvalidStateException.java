package com.phaseforge.core.engine;

import com.phaseforge.core.PipelineException;
import com.phaseforge.core.model.RunStatus;

/**
 * An operation was requested in a run status that does not allow it.
 */
public class InvalidStateException extends PipelineException {

    private final RunStatus status;

    public InvalidStateException(String operation, RunStatus status, String hint) {
        super("Cannot " + operation + " a run that is " + status.wireName() + (hint != null ? ". " + hint : ""));
        this.status = status;
    }

    public RunStatus getStatus() {
        return status;
    }
}
