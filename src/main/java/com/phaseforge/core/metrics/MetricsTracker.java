package com.phaseforge.core.metrics;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.RunStatus;
import com.phaseforge.core.model.ValidationStatus;
import com.phaseforge.core.model.WorkerMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates timing and outcome figures for one run.
 * <p>
 * A phase bracketed by {@link #startPhase} and {@link #endPhase} becomes visible in
 * {@link #snapshot()} only once it has ended; worker figures recorded in between stay with the
 * in-flight phase until then. Re-running a phase replaces its figures and bumps its attempt
 * count. Safe for use from worker threads.
 */
public class MetricsTracker {

    private final String runId;
    private final Clock clock;
    private final Instant startedAt;
    private final Map<String, PhaseMetrics> finished = new LinkedHashMap<>();
    private int totalRetries;
    private Instant endedAt;
    private String status;

    private String inFlightPhase;
    private Instant inFlightStartedAt;
    private final Map<String, WorkerMetrics> inFlightWorkers = new LinkedHashMap<>();

    public MetricsTracker(String runId, Clock clock) {
        this(RunMetrics.empty(runId, clock.instant()), clock);
    }

    /**
     * Continues from a previously saved snapshot, for runs resumed in a new process.
     */
    public MetricsTracker(RunMetrics previous, Clock clock) {
        this.runId = previous.runId();
        this.clock = clock;
        this.startedAt = previous.startedAt() != null ? previous.startedAt() : clock.instant();
        this.finished.putAll(previous.phases());
        this.totalRetries = previous.totalRetries();
        this.endedAt = previous.endedAt();
        this.status = previous.status() != null ? previous.status() : RunStatus.RUNNING.wireName();
    }

    public synchronized void startPhase(String phase) {
        inFlightPhase = phase;
        inFlightStartedAt = clock.instant();
        inFlightWorkers.clear();
    }

    public synchronized void recordWorker(String phase, String workerId, Duration duration,
                                          int exitCode, int retryCount) {
        if (!phase.equals(inFlightPhase)) {
            throw new IllegalStateException("Phase '" + phase + "' is not in flight");
        }
        inFlightWorkers.put(workerId, new WorkerMetrics(seconds(duration), exitCode, retryCount));
    }

    public synchronized void endPhase(String phase, ValidationStatus validationStatus, int artifactCount) {
        if (!phase.equals(inFlightPhase)) {
            throw new IllegalStateException("Phase '" + phase + "' is not in flight");
        }
        Instant now = clock.instant();
        PhaseMetrics previous = finished.get(phase);
        int attempts = previous != null ? previous.attempts() + 1 : 1;
        PhaseMetrics metrics = new PhaseMetrics(phase, inFlightStartedAt, now,
                seconds(Duration.between(inFlightStartedAt, now)), attempts,
                inFlightWorkers, validationStatus, artifactCount);
        totalRetries += metrics.retries();
        finished.put(phase, metrics);

        inFlightPhase = null;
        inFlightStartedAt = null;
        inFlightWorkers.clear();
    }

    /** Stamps the end of the run. */
    public synchronized void finish(RunStatus finalStatus) {
        endedAt = clock.instant();
        status = finalStatus.wireName();
    }

    public synchronized void updateStatus(RunStatus current) {
        status = current.wireName();
    }

    public synchronized RunMetrics snapshot() {
        Instant end = endedAt != null ? endedAt : clock.instant();
        double duration = seconds(Duration.between(startedAt, end));
        int score = HygieneScorer.score(finished.values(), totalRetries);
        return new RunMetrics(runId, startedAt, endedAt, duration, finished, totalRetries, score, status);
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
