package com.phaseforge.core.reliability;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;

/**
 * Maps failures onto {@link ErrorKind}.
 * <p>
 * Structured signals win: a {@link ClassifiedFailure}, a timeout, an I/O failure, or an exit code
 * from the policy's transient set. Matching the failure text against the policy's transient
 * messages is the last resort before {@link ErrorKind#PERMANENT}.
 */
public class TransientErrorClassifier {

    /** Exit code reported for an attempt that was killed by its timeout. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public ErrorKind classify(Throwable error, RetryPolicy policy) {
        if (error instanceof ClassifiedFailure classified) {
            return classified.errorKind();
        }
        if (error instanceof HttpTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return ErrorKind.CONNECTION;
        }
        return matchesTransientMessage(error.getMessage(), policy)
                ? ErrorKind.TRANSIENT_MESSAGE
                : ErrorKind.PERMANENT;
    }

    /**
     * Classifies a worker that ran to completion but reported failure. The worker's own exit code
     * counts only through the policy, 124 included; attempts cut off by a timeout arrive already
     * classified.
     */
    public ErrorKind classifyExit(int exitCode, String failureText, RetryPolicy policy) {
        if (policy.transientExitCodes().contains(exitCode)) {
            return ErrorKind.TRANSIENT_EXIT_CODE;
        }
        return matchesTransientMessage(failureText, policy)
                ? ErrorKind.TRANSIENT_MESSAGE
                : ErrorKind.PERMANENT;
    }

    public boolean isRetryable(Throwable error, RetryPolicy policy) {
        return classify(error, policy).isTransient();
    }

    private static boolean matchesTransientMessage(String text, RetryPolicy policy) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase();
        return policy.transientMessages().stream().anyMatch(lower::contains);
    }
}
