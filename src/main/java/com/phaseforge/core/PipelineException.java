package com.phaseforge.core;

/**
 * Base type for every error the pipeline raises to its callers.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
