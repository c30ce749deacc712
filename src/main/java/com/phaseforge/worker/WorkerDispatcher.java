package com.phaseforge.worker;

import com.phaseforge.core.logging.MdcContext;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.ErrorKind;
import com.phaseforge.core.reliability.RetryExecutor;
import com.phaseforge.core.reliability.RetryPolicy;
import com.phaseforge.core.reliability.TimeoutExceededException;
import com.phaseforge.core.reliability.TimeoutGuard;
import com.phaseforge.core.reliability.TransientErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a worker to a final {@link WorkerOutcome}: picks the executor for the worker's kind, bounds
 * each attempt by the worker's timeout, and retries transient failures.
 * <p>
 * Never throws for worker failures. The returned outcome carries the last attempt's result, the
 * retries consumed and the wall-clock time across all attempts.
 */
@Service
public class WorkerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkerDispatcher.class);

    private final LocalProcessExecutor localExecutor;
    private final RemoteCallExecutor remoteExecutor;
    private final TimeoutGuard timeoutGuard;
    private final RetryExecutor retryExecutor;
    private final TransientErrorClassifier classifier;

    public WorkerDispatcher(LocalProcessExecutor localExecutor,
                            RemoteCallExecutor remoteExecutor,
                            TimeoutGuard timeoutGuard,
                            RetryExecutor retryExecutor,
                            TransientErrorClassifier classifier) {
        this.localExecutor = localExecutor;
        this.remoteExecutor = remoteExecutor;
        this.timeoutGuard = timeoutGuard;
        this.retryExecutor = retryExecutor;
        this.classifier = classifier;
    }

    public WorkerOutcome dispatch(WorkerSpec spec, WorkerContext context, RetryPolicy policy) {
        MdcContext.setWorker(context.runId(), context.phase(), spec.id());
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        try {
            WorkerOutcome outcome = retryExecutor.execute(attempt -> {
                attempts.set(attempt);
                WorkerOutcome result = timeoutGuard.withTimeout(() -> runOnce(spec, context), spec.timeout());
                if (!result.success()) {
                    throw new WorkerAttemptFailedException(classified(result, policy));
                }
                return result;
            }, policy, error -> classifier.isRetryable(error, policy));
            return finish(outcome, attempts.get(), startNanos);
        } catch (WorkerAttemptFailedException e) {
            return finish(e.getOutcome(), attempts.get(), startNanos);
        } catch (TimeoutExceededException e) {
            WorkerOutcome timedOut = WorkerOutcome.failed(spec.id(), TransientErrorClassifier.TIMEOUT_EXIT_CODE,
                    e.getMessage(), null, 0, ErrorKind.TIMEOUT);
            return finish(timedOut, attempts.get(), startNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            WorkerOutcome interrupted = WorkerOutcome.failed(spec.id(), 1, "Interrupted while waiting to retry",
                    null, 0, ErrorKind.PERMANENT);
            return finish(interrupted, attempts.get(), startNanos);
        } catch (Exception e) {
            log.error("Worker {} failed unexpectedly", spec.id(), e);
            WorkerOutcome failed = WorkerOutcome.failed(spec.id(), 1, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    null, 0, classifier.classify(e, policy));
            return finish(failed, attempts.get(), startNanos);
        } finally {
            MdcContext.clearWorker();
        }
    }

    private WorkerOutcome runOnce(WorkerSpec spec, WorkerContext context) {
        MdcContext.setWorker(context.runId(), context.phase(), spec.id());
        try {
            if (spec instanceof WorkerSpec.Local local) {
                return localExecutor.run(local, context);
            }
            if (spec instanceof WorkerSpec.Remote remote) {
                return remoteExecutor.run(remote, context);
            }
            throw new IllegalArgumentException("Unsupported worker kind: " + spec.getClass().getSimpleName());
        } finally {
            MdcContext.clearWorker();
        }
    }

    private WorkerOutcome classified(WorkerOutcome result, RetryPolicy policy) {
        if (result.failureKind() != null) {
            return result;
        }
        String text = String.join("\n", result.errors()) + "\n" + result.notes();
        ErrorKind kind = classifier.classifyExit(result.exitCode(), text, policy);
        return new WorkerOutcome(result.workerId(), false, result.artifacts(), result.notes(), result.errors(),
                result.exitCode(), result.durationMs(), result.retryCount(), kind);
    }

    private static WorkerOutcome finish(WorkerOutcome outcome, int attempts, long startNanos) {
        long totalMs = (System.nanoTime() - startNanos) / 1_000_000;
        return outcome.withRetryCount(Math.max(0, attempts - 1)).withDuration(totalMs);
    }
}
