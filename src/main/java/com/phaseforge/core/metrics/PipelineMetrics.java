package com.phaseforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Process-wide Micrometer meters for pipeline execution. Per-run figures live in
 * {@link MetricsTracker}; these aggregate across runs for whatever registry is configured.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkerExecution(String workerId, boolean success, Duration duration) {
        Timer.builder("phaseforge.worker.duration")
                .tag("worker", workerId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(duration);
    }

    public void recordRetries(String workerId, int retries) {
        if (retries <= 0) {
            return;
        }
        Counter.builder("phaseforge.worker.retries")
                .description("Retries consumed by worker invocations")
                .tag("worker", workerId)
                .register(registry)
                .increment(retries);
    }

    public void recordPhaseResult(String phase, String result) {
        Counter.builder("phaseforge.phase.results")
                .tag("phase", phase)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordArtifactCount(String phase, int count) {
        DistributionSummary.builder("phaseforge.phase.artifacts")
                .tag("phase", phase)
                .register(registry)
                .record(count);
    }

    /**
     * @param approved true for approve, false for reject
     */
    public void recordDecision(String phase, boolean approved) {
        Counter.builder("phaseforge.approval.decisions")
                .tag("phase", phase)
                .tag("decision", approved ? "approved" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("phaseforge.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
