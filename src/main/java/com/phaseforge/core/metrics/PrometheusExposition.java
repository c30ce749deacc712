package com.phaseforge.core.metrics;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.ValidationStatus;
import com.phaseforge.core.model.WorkerMetrics;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders {@link RunMetrics} in the Prometheus text exposition format.
 */
public final class PrometheusExposition {

    private PrometheusExposition() {
    }

    public static String format(RunMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        Map<String, String> run = labels("run_id", metrics.runId());

        appendHeader(sb, "phaseforge_phase_duration_seconds", "Duration of the latest attempt of each phase");
        metrics.phases().values().forEach(p ->
                appendSample(sb, "phaseforge_phase_duration_seconds", phaseLabels(metrics, p), p.durationSeconds()));

        appendHeader(sb, "phaseforge_phase_attempts", "Times each phase has been executed");
        metrics.phases().values().forEach(p ->
                appendSample(sb, "phaseforge_phase_attempts", phaseLabels(metrics, p), p.attempts()));

        appendHeader(sb, "phaseforge_phase_artifacts", "Artifacts matched by the latest attempt of each phase");
        metrics.phases().values().forEach(p ->
                appendSample(sb, "phaseforge_phase_artifacts", phaseLabels(metrics, p), p.artifactCount()));

        appendHeader(sb, "phaseforge_phase_validation_passed", "Whether validation passed (1=pass, 0.5=partial, 0=fail)");
        metrics.phases().values().forEach(p ->
                appendSample(sb, "phaseforge_phase_validation_passed", phaseLabels(metrics, p),
                        validationValue(p.validationStatus())));

        appendHeader(sb, "phaseforge_worker_duration_seconds", "Worker wall-clock duration, all attempts");
        forEachWorker(metrics, (labels, w) ->
                appendSample(sb, "phaseforge_worker_duration_seconds", labels, w.durationSeconds()));

        appendHeader(sb, "phaseforge_worker_exit_code", "Worker exit code of the final attempt");
        forEachWorker(metrics, (labels, w) ->
                appendSample(sb, "phaseforge_worker_exit_code", labels, w.exitCode()));

        appendHeader(sb, "phaseforge_worker_retries", "Retries consumed by the worker");
        forEachWorker(metrics, (labels, w) ->
                appendSample(sb, "phaseforge_worker_retries", labels, w.retryCount()));

        appendHeader(sb, "phaseforge_run_duration_seconds", "Run duration");
        appendSample(sb, "phaseforge_run_duration_seconds", run, metrics.durationSeconds());
        appendHeader(sb, "phaseforge_run_retries_total", "Retries across the whole run");
        appendSample(sb, "phaseforge_run_retries_total", run, metrics.totalRetries());
        appendHeader(sb, "phaseforge_run_hygiene_score", "Run hygiene score (0-100)");
        appendSample(sb, "phaseforge_run_hygiene_score", run, metrics.hygieneScore());
        return sb.toString();
    }

    private interface WorkerSampleWriter {
        void write(Map<String, String> labels, WorkerMetrics worker);
    }

    private static void forEachWorker(RunMetrics metrics, WorkerSampleWriter writer) {
        for (PhaseMetrics phase : metrics.phases().values()) {
            phase.workers().forEach((workerId, worker) -> {
                Map<String, String> labels = phaseLabels(metrics, phase);
                labels.put("worker", workerId);
                writer.write(labels, worker);
            });
        }
    }

    private static Map<String, String> phaseLabels(RunMetrics metrics, PhaseMetrics phase) {
        Map<String, String> labels = labels("run_id", metrics.runId());
        labels.put("phase", phase.phase());
        return labels;
    }

    private static Map<String, String> labels(String key, String value) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(key, value);
        return labels;
    }

    private static double validationValue(ValidationStatus status) {
        if (status == null) {
            return 0.0;
        }
        switch (status) {
            case PASS:
                return 1.0;
            case PARTIAL:
                return 0.5;
            default:
                return 0.0;
        }
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
    }

    private static void appendSample(StringBuilder sb, String metric, Map<String, String> labels, double value) {
        sb.append(metric);
        if (!labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(e.getKey()).append("=\"").append(escapeLabel(e.getValue())).append('"');
                first = false;
            }
            sb.append('}');
        }
        sb.append(' ').append(formatValue(value)).append('\n');
    }

    static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.3f", value);
    }

    static String escapeLabel(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
