package com.phaseforge.core.reliability;

import com.phaseforge.core.PipelineException;

import java.time.Duration;

/**
 * Thrown when a guarded operation does not finish within its time budget.
 */
public class TimeoutExceededException extends PipelineException implements ClassifiedFailure {

    private final Duration timeout;

    public TimeoutExceededException(Duration timeout) {
        super("Operation timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.TIMEOUT;
    }
}
