package com.phaseforge.worker;

import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;

/**
 * Runs one attempt of a worker.
 * <p>
 * Implementations report every failure through the returned outcome ({@code success=false},
 * errors, exit code) and do not throw. An interrupt must stop the attempt promptly, including any
 * process it started.
 */
public interface WorkerExecutor<S extends WorkerSpec> {

    WorkerOutcome run(S spec, WorkerContext context);
}
