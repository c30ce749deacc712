package com.phaseforge.core.persistence;

import com.phaseforge.core.PipelineException;

/**
 * A run snapshot could not be written or read. When raised from a transition, the transition
 * did not happen.
 */
public class StatePersistenceException extends PipelineException {

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
