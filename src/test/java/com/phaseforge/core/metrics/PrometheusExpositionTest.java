package com.phaseforge.core.metrics;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.ValidationStatus;
import com.phaseforge.core.model.WorkerMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusExpositionTest {

    private static RunMetrics sample() {
        Instant start = Instant.parse("2026-03-01T10:00:00Z");
        PhaseMetrics build = new PhaseMetrics("build", start, start.plusSeconds(2), 2.25, 1,
                Map.of("backend", new WorkerMetrics(1.5, 0, 2)), ValidationStatus.PARTIAL, 1);
        return new RunMetrics("PF-1", start, null, 4.0, Map.of("build", build), 2, 91, "needs_revision");
    }

    @Test
    @DisplayName("every metric has HELP and TYPE lines")
    void headers() {
        String text = PrometheusExposition.format(sample());

        assertTrue(text.contains("# HELP phaseforge_phase_duration_seconds "));
        assertTrue(text.contains("# TYPE phaseforge_phase_duration_seconds gauge"));
        assertTrue(text.contains("# TYPE phaseforge_run_hygiene_score gauge"));
    }

    @Test
    @DisplayName("samples carry run, phase and worker labels")
    void samples() {
        String text = PrometheusExposition.format(sample());

        assertTrue(text.contains("phaseforge_phase_duration_seconds{run_id=\"PF-1\",phase=\"build\"} 2.250\n"));
        assertTrue(text.contains("phaseforge_phase_validation_passed{run_id=\"PF-1\",phase=\"build\"} 0.500\n"));
        assertTrue(text.contains("phaseforge_worker_retries{run_id=\"PF-1\",phase=\"build\",worker=\"backend\"} 2\n"));
        assertTrue(text.contains("phaseforge_run_retries_total{run_id=\"PF-1\"} 2\n"));
        assertTrue(text.contains("phaseforge_run_hygiene_score{run_id=\"PF-1\"} 91\n"));
    }

    @Test
    @DisplayName("the same metrics always render the same text")
    void deterministic() {
        assertEquals(PrometheusExposition.format(sample()), PrometheusExposition.format(sample()));
    }

    @Test
    @DisplayName("label values are escaped")
    void escaping() {
        assertEquals("a\\\"b\\\\c\\nd", PrometheusExposition.escapeLabel("a\"b\\c\nd"));
        assertEquals("", PrometheusExposition.escapeLabel(null));
    }

    @Test
    @DisplayName("whole numbers print without decimals")
    void valueFormatting() {
        assertEquals("3", PrometheusExposition.formatValue(3.0));
        assertEquals("0.125", PrometheusExposition.formatValue(0.125));
    }
}
