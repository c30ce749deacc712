package com.phaseforge.dispatch.cli;

import com.phaseforge.core.model.RunStatus;

/**
 * Process exit codes of the CLI.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;
    /** The run is waiting on a decision or on a fix. */
    public static final int NEEDS_ATTENTION = 2;

    private ExitCodes() {
    }

    public static int forStatus(RunStatus status) {
        return status != null && status.needsAttention() ? NEEDS_ATTENTION : SUCCESS;
    }
}
