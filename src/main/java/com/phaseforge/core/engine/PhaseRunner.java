package com.phaseforge.core.engine;

import com.phaseforge.core.config.WorkflowDefinition;
import com.phaseforge.core.events.EventBus;
import com.phaseforge.core.events.PipelineEvent;
import com.phaseforge.core.logging.MdcContext;
import com.phaseforge.core.metrics.MetricsTracker;
import com.phaseforge.core.metrics.PipelineMetrics;
import com.phaseforge.core.model.PhaseSpec;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.ErrorKind;
import com.phaseforge.worker.WorkerContext;
import com.phaseforge.worker.WorkerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs the workers of one phase, sequentially or through a {@link BoundedWorkerPool}, and
 * records each worker's figures as it finishes.
 * <p>
 * Outcomes are always returned in the phase's declared worker order. A sequential phase with
 * {@code failFast} stops at the first failed worker; the workers after it are not run.
 */
@Component
public class PhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunner.class);

    private final WorkerDispatcher dispatcher;
    private final EventBus eventBus;
    private final PipelineMetrics pipelineMetrics;
    private final Clock clock;

    public PhaseRunner(WorkerDispatcher dispatcher, EventBus eventBus, PipelineMetrics pipelineMetrics, Clock clock) {
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.pipelineMetrics = pipelineMetrics;
        this.clock = clock;
    }

    public List<WorkerOutcome> runWorkers(PhaseSpec phase, WorkflowDefinition workflow,
                                          WorkerContext context, MetricsTracker tracker) {
        List<WorkerSpec> workers = phase.workers().stream().map(workflow::worker).toList();
        if (workers.isEmpty()) {
            log.info("Phase {} has no workers", phase.name());
            return List.of();
        }
        if (phase.parallel() && workers.size() > 1) {
            return runParallel(phase, workers, workflow, context, tracker);
        }
        return runSequential(phase, workers, workflow, context, tracker);
    }

    private List<WorkerOutcome> runSequential(PhaseSpec phase, List<WorkerSpec> workers, WorkflowDefinition workflow,
                                              WorkerContext context, MetricsTracker tracker) {
        List<WorkerOutcome> outcomes = new ArrayList<>();
        for (WorkerSpec worker : workers) {
            WorkerOutcome outcome = runOne(worker, workflow, context, tracker);
            outcomes.add(outcome);
            if (!outcome.success() && phase.failFast()) {
                log.warn("Worker {} failed, skipping {} remaining worker(s) of phase {}",
                        worker.id(), workers.size() - outcomes.size(), phase.name());
                break;
            }
        }
        return outcomes;
    }

    private List<WorkerOutcome> runParallel(PhaseSpec phase, List<WorkerSpec> workers, WorkflowDefinition workflow,
                                            WorkerContext context, MetricsTracker tracker) {
        int bound = Math.min(phase.maxConcurrency(), workers.size());
        log.info("Running {} worker(s) of phase {} with concurrency {}", workers.size(), phase.name(), bound);

        List<Callable<WorkerOutcome>> tasks = new ArrayList<>();
        for (WorkerSpec worker : workers) {
            tasks.add(() -> {
                MdcContext.setPhase(context.runId(), context.phase());
                try {
                    return runOne(worker, workflow, context, tracker);
                } finally {
                    MdcContext.clear();
                }
            });
        }

        try (BoundedWorkerPool pool = new BoundedWorkerPool(bound, "phaseforge-" + phase.name() + "-")) {
            return pool.runAll(tasks, (index, error) -> {
                WorkerSpec worker = workers.get(index);
                log.error("Infrastructure error running worker {}: {}", worker.id(), error.getMessage());
                WorkerOutcome failed = WorkerOutcome.failed(worker.id(), 1, error.getMessage(), null, 0,
                        ErrorKind.PERMANENT);
                tracker.recordWorker(phase.name(), worker.id(), Duration.ZERO, failed.exitCode(), 0);
                return failed;
            });
        }
    }

    private WorkerOutcome runOne(WorkerSpec worker, WorkflowDefinition workflow,
                                 WorkerContext context, MetricsTracker tracker) {
        eventBus.publish(new PipelineEvent("worker.started", context.runId(), context.phase(),
                Map.of("worker", worker.id()), clock.instant()));

        WorkerOutcome outcome = dispatcher.dispatch(worker, context, workflow.retryPolicy());

        tracker.recordWorker(context.phase(), worker.id(), Duration.ofMillis(outcome.durationMs()),
                outcome.exitCode(), outcome.retryCount());
        pipelineMetrics.recordWorkerExecution(worker.id(), outcome.success(), Duration.ofMillis(outcome.durationMs()));
        pipelineMetrics.recordRetries(worker.id(), outcome.retryCount());

        eventBus.publish(new PipelineEvent("worker.finished", context.runId(), context.phase(),
                Map.of("worker", worker.id(),
                        "success", outcome.success(),
                        "exitCode", outcome.exitCode(),
                        "retries", outcome.retryCount()),
                clock.instant()));
        return outcome;
    }
}
