package com.phaseforge.worker;

import com.phaseforge.core.PipelineException;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.reliability.ClassifiedFailure;
import com.phaseforge.core.reliability.ErrorKind;

/**
 * Carries a failed worker attempt through the retry loop.
 */
public class WorkerAttemptFailedException extends PipelineException implements ClassifiedFailure {

    private final transient WorkerOutcome outcome;

    public WorkerAttemptFailedException(WorkerOutcome outcome) {
        super("Worker " + outcome.workerId() + " failed: " + String.join("; ", outcome.errors()));
        this.outcome = outcome;
    }

    public WorkerOutcome getOutcome() {
        return outcome;
    }

    @Override
    public ErrorKind errorKind() {
        return outcome.failureKind() != null ? outcome.failureKind() : ErrorKind.PERMANENT;
    }
}
