package com.phaseforge.core.reliability;

/**
 * Closed classification of worker failures. Only transient kinds are retried.
 */
public enum ErrorKind {
    /** The attempt exceeded its time budget. */
    TIMEOUT(true),
    /** The remote endpoint could not be reached or the connection broke. */
    CONNECTION(true),
    /** The worker exited with a code configured as transient. */
    TRANSIENT_EXIT_CODE(true),
    /** The failure text matched a configured transient message. */
    TRANSIENT_MESSAGE(true),
    PERMANENT(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
