package com.phaseforge.core.engine;

import com.phaseforge.core.checkpoint.CheckpointValidator;
import com.phaseforge.core.config.WorkflowConfigurationException;
import com.phaseforge.core.config.WorkflowDefinition;
import com.phaseforge.core.consensus.ConsensusGate;
import com.phaseforge.core.consensus.DecisionRecorder;
import com.phaseforge.core.events.EventBus;
import com.phaseforge.core.events.PipelineEvent;
import com.phaseforge.core.logging.MdcContext;
import com.phaseforge.core.metrics.MetricsStore;
import com.phaseforge.core.metrics.MetricsTracker;
import com.phaseforge.core.metrics.PipelineMetrics;
import com.phaseforge.core.model.ApprovalPackage;
import com.phaseforge.core.model.PhaseOutcome;
import com.phaseforge.core.model.PhaseSpec;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.RunState;
import com.phaseforge.core.model.RunStatus;
import com.phaseforge.core.model.ValidationResult;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.persistence.StatePersistenceException;
import com.phaseforge.core.persistence.StateStore;
import com.phaseforge.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives runs through their phases.
 * <p>
 * Every operation reloads the run from the {@link StateStore}, so callers in different
 * processes see each other's transitions. A transition becomes real only once its snapshot has
 * been written; if the write fails the caller gets a {@link StatePersistenceException} and the
 * stored run is unchanged.
 * <p>
 * Operations on the same run are mutually exclusive and non-reentrant: a call arriving while
 * another is in progress fails with {@link RunBusyException} instead of waiting.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    private static final DateTimeFormatter RUN_ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final WorkflowDefinition workflow;
    private final StateStore stateStore;
    private final PhaseRunner phaseRunner;
    private final CheckpointValidator validator;
    private final ConsensusGate consensusGate;
    private final DecisionRecorder decisionRecorder;
    private final MetricsStore metricsStore;
    private final EventBus eventBus;
    private final PipelineMetrics pipelineMetrics;
    private final Clock clock;

    private final AtomicInteger runCounter = new AtomicInteger();
    // runs with an operation in progress; an id leaves the set when its operation ends
    private final Set<String> busyRuns = ConcurrentHashMap.newKeySet();

    public RunEngine(WorkflowDefinition workflow,
                     StateStore stateStore,
                     PhaseRunner phaseRunner,
                     CheckpointValidator validator,
                     ConsensusGate consensusGate,
                     DecisionRecorder decisionRecorder,
                     MetricsStore metricsStore,
                     EventBus eventBus,
                     PipelineMetrics pipelineMetrics,
                     Clock clock) {
        this.workflow = workflow;
        this.stateStore = stateStore;
        this.phaseRunner = phaseRunner;
        this.validator = validator;
        this.consensusGate = consensusGate;
        this.decisionRecorder = decisionRecorder;
        this.metricsStore = metricsStore;
        this.eventBus = eventBus;
        this.pipelineMetrics = pipelineMetrics;
        this.clock = clock;
    }

    /**
     * Starts a new run positioned on the first enabled phase.
     *
     * @param metadata request parameters kept with the run and handed to workers
     */
    public RunState start(Map<String, String> metadata) {
        String firstPhase = workflow.firstEnabledPhase();
        if (firstPhase == null) {
            throw new WorkflowConfigurationException("No enabled phases in the workflow");
        }

        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            Instant now = clock.instant();
            RunState state = RunState.started(runId, firstPhase, metadata, now);
            MetricsTracker tracker = new MetricsTracker(RunMetrics.empty(runId, now), clock);

            metricsStore.save(tracker.snapshot());
            stateStore.save(state);

            log.info("Started run {} at phase {}", runId, firstPhase);
            publish("run.started", state, null, Map.of("phase", firstPhase));
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Executes the current phase and moves the run according to the result.
     */
    public PhaseOutcome advance(String runId) {
        return guarded(runId, () -> {
            RunState state = load(runId);
            if (state.status() != RunStatus.RUNNING) {
                throw new InvalidStateException("advance", state.status(), hintFor(state));
            }
            String phaseName = state.currentPhase();
            PhaseSpec phase = workflow.phase(phaseName);
            MdcContext.setPhase(runId, phaseName);

            MetricsTracker tracker = trackerFor(state);
            tracker.startPhase(phaseName);
            log.info("Executing phase {} ({} worker(s), {})", phaseName, phase.workers().size(),
                    phase.parallel() ? "parallel x" + phase.maxConcurrency() : "sequential");
            publish("phase.started", state, phaseName, Map.of("workers", phase.workers()));

            WorkerContext context = new WorkerContext(runId, phaseName, workflow.projectRoot(),
                    state.phaseArtifacts(), state.metadata());
            List<WorkerOutcome> workerOutcomes = phaseRunner.runWorkers(phase, workflow, context, tracker);
            ValidationResult validation = validator.validate(phase.requiredArtifacts(), workflow.projectRoot());
            tracker.endPhase(phaseName, validation.status(), validation.matchedFiles().size());
            pipelineMetrics.recordArtifactCount(phaseName, validation.matchedFiles().size());

            boolean workersOk = workerOutcomes.stream().allMatch(WorkerOutcome::success);
            boolean success = workersOk && validation.passed();
            Instant now = clock.instant();

            PhaseOutcome outcome;
            RunState next;
            if (!success) {
                outcome = new PhaseOutcome(phaseName, false, workerOutcomes, validation,
                        phase.requiresApproval(), false, now, null);
                next = state.withStatus(RunStatus.NEEDS_REVISION, now)
                        .withErrors(failureMessages(phaseName, outcome), now);
                log.warn("Phase {} failed (workers ok: {}, validation: {}), run needs revision",
                        phaseName, workersOk, validation.status());
            } else if (phase.requiresApproval()) {
                outcome = new PhaseOutcome(phaseName, true, workerOutcomes, validation,
                        true, true, now, null);
                ApprovalPackage approval = consensusGate.buildApprovalPackage(runId, outcome, tracker.snapshot());
                outcome = outcome.withApprovalPackage(relativeToRoot(approval));
                next = state.withPhaseArtifacts(phaseName, collectArtifacts(validation, workerOutcomes), now)
                        .withApprovalPending(phaseName, now);
            } else {
                outcome = new PhaseOutcome(phaseName, true, workerOutcomes, validation,
                        false, false, now, null);
                next = state.withPhaseArtifacts(phaseName, collectArtifacts(validation, workerOutcomes), now)
                        .withPhaseCompleted(workflow.nextEnabledPhase(phaseName), now);
            }

            commit(next, tracker);

            String result = !success ? "failed" : outcome.awaitingApproval() ? "awaiting_approval" : "passed";
            pipelineMetrics.recordPhaseResult(phaseName, result);
            publish("phase.finished", next, phaseName, Map.of(
                    "result", result,
                    "validation", validation.status().wireName(),
                    "retries", outcome.totalRetries()));
            announce(next, state);
            return outcome;
        });
    }

    /**
     * Accepts the phase awaiting approval and moves to the next enabled phase, completing the run
     * when there is none.
     */
    public RunState approve(String runId) {
        return guarded(runId, () -> {
            RunState state = load(runId);
            if (state.status() != RunStatus.AWAITING_APPROVAL) {
                throw new InvalidStateException("approve", state.status(), hintFor(state));
            }
            String phaseName = state.approvalPhase() != null ? state.approvalPhase() : state.currentPhase();
            MdcContext.setPhase(runId, phaseName);
            Instant now = clock.instant();

            RunState next = state.withApprovalCleared(now)
                    .withPhaseCompleted(workflow.nextEnabledPhase(phaseName), now);
            commit(next, trackerFor(state));
            recordDecision(runId, phaseName, true, null, now);

            log.info("Phase {} approved", phaseName);
            pipelineMetrics.recordDecision(phaseName, true);
            publish("phase.approved", next, phaseName, Map.of());
            announce(next, state);
            return next;
        });
    }

    /**
     * Sends the phase awaiting approval back for revision. The run stays on the same phase.
     */
    public RunState reject(String runId, String reason) {
        return guarded(runId, () -> {
            RunState state = load(runId);
            if (state.status() != RunStatus.AWAITING_APPROVAL) {
                throw new InvalidStateException("reject", state.status(), hintFor(state));
            }
            String phaseName = state.approvalPhase() != null ? state.approvalPhase() : state.currentPhase();
            String why = reason == null || reason.isBlank() ? "no reason given" : reason.strip();
            MdcContext.setPhase(runId, phaseName);
            Instant now = clock.instant();

            RunState next = state.withApprovalCleared(now)
                    .withStatus(RunStatus.NEEDS_REVISION, now)
                    .withError("Phase " + phaseName + " rejected: " + why, now);
            commit(next, trackerFor(state));
            recordDecision(runId, phaseName, false, why, now);

            log.info("Phase {} rejected: {}", phaseName, why);
            pipelineMetrics.recordDecision(phaseName, false);
            publish("phase.rejected", next, phaseName, Map.of("reason", why));
            return next;
        });
    }

    /**
     * Returns a run that needs revision to running, on the same phase.
     */
    public RunState resume(String runId) {
        return guarded(runId, () -> {
            RunState state = load(runId);
            if (state.status() != RunStatus.NEEDS_REVISION) {
                throw new InvalidStateException("resume", state.status(), hintFor(state));
            }
            RunState next = state.withStatus(RunStatus.RUNNING, clock.instant());
            commit(next, trackerFor(state));

            log.info("Run {} resumed at phase {}", runId, next.currentPhase());
            publish("run.resumed", next, next.currentPhase(), Map.of());
            return next;
        });
    }

    public RunState status(String runId) {
        return load(runId);
    }

    public Optional<RunMetrics> metrics(String runId) {
        load(runId);
        return metricsStore.load(runId);
    }

    public Optional<String> metricsExposition(String runId) {
        load(runId);
        return metricsStore.loadExposition(runId);
    }

    /** The most recently updated run. */
    public String latestRunId() {
        return stateStore.latest()
                .map(RunState::runId)
                .orElseThrow(() -> new RunNotFoundException(null));
    }

    /** All runs, most recently updated first. */
    public List<RunState> listRuns() {
        List<RunState> runs = new ArrayList<>();
        for (String id : stateStore.listRunIds()) {
            stateStore.load(id).ifPresent(runs::add);
        }
        runs.sort(Comparator.comparing(RunState::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .reversed());
        return runs;
    }

    int busyRunCount() {
        return busyRuns.size();
    }

    public WorkflowDefinition workflow() {
        return workflow;
    }

    // -- internals -------------------------------------------------------------

    private <T> T guarded(String runId, Supplier<T> operation) {
        if (!busyRuns.add(runId)) {
            log.warn("Rejected concurrent operation on run {}", runId);
            throw new RunBusyException(runId);
        }
        MdcContext.setRun(runId);
        try {
            return operation.get();
        } finally {
            MdcContext.clear();
            busyRuns.remove(runId);
        }
    }

    private RunState load(String runId) {
        return stateStore.load(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private MetricsTracker trackerFor(RunState state) {
        RunMetrics previous = metricsStore.load(state.runId())
                .orElseGet(() -> RunMetrics.empty(state.runId(), state.createdAt()));
        return new MetricsTracker(previous, clock);
    }

    /**
     * Writes metrics, then the state snapshot. Only the snapshot decides whether the
     * transition happened.
     */
    private void commit(RunState next, MetricsTracker tracker) {
        if (next.isCompleted()) {
            tracker.finish(RunStatus.COMPLETED);
        } else {
            tracker.updateStatus(next.status());
        }
        metricsStore.save(tracker.snapshot());
        stateStore.save(next);
    }

    private void recordDecision(String runId, String phase, boolean approved, String reason, Instant at) {
        try {
            decisionRecorder.record(runId, phase, approved, reason, at);
        } catch (StatePersistenceException e) {
            log.warn("Decision for phase {} applied but its record could not be written: {}", phase, e.getMessage());
        }
    }

    private void announce(RunState next, RunState previous) {
        if (next.isCompleted() && !previous.isCompleted()) {
            log.info("Run {} completed ({} phase(s))", next.runId(), next.completedPhases().size());
            pipelineMetrics.recordRunResult(RunStatus.COMPLETED.wireName());
            publish("run.completed", next, null, Map.of("phases", next.completedPhases()));
        }
    }

    private void publish(String type, RunState state, String phase, Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(type, state.runId(), phase, payload, clock.instant()));
    }

    private String generateRunId() {
        String stamp = RUN_ID_STAMP.format(clock.instant());
        String candidate;
        do {
            candidate = String.format("PF-%s-%04d", stamp, runCounter.incrementAndGet());
        } while (stateStore.load(candidate).isPresent());
        return candidate;
    }

    /** Files matched by validation first, then anything workers declared beyond them. */
    static List<String> collectArtifacts(ValidationResult validation, List<WorkerOutcome> outcomes) {
        Set<String> artifacts = new LinkedHashSet<>(validation.matchedFiles());
        for (WorkerOutcome outcome : outcomes) {
            artifacts.addAll(outcome.artifacts());
        }
        return List.copyOf(artifacts);
    }

    private static List<String> failureMessages(String phaseName, PhaseOutcome outcome) {
        List<String> messages = new ArrayList<>();
        for (String error : outcome.errors()) {
            messages.add("Phase " + phaseName + " worker " + error);
        }
        ValidationResult validation = outcome.validation();
        if (!validation.passed()) {
            messages.add("Phase " + phaseName + " validation " + validation.status().wireName()
                    + ", missing: " + String.join(", ", validation.missing()));
        }
        return messages;
    }

    private String relativeToRoot(ApprovalPackage approval) {
        return workflow.projectRoot().relativize(approval.path().toAbsolutePath().normalize())
                .toString().replace('\\', '/');
    }

    private static String hintFor(RunState state) {
        switch (state.status()) {
            case AWAITING_APPROVAL:
                return "Phase " + state.approvalPhase() + " is awaiting approve or reject";
            case NEEDS_REVISION:
                return "Resume the run once the problems are fixed";
            case COMPLETED:
                return "The run has finished";
            case RUNNING:
                return "Advance the run to execute phase " + state.currentPhase();
            default:
                return null;
        }
    }
}
