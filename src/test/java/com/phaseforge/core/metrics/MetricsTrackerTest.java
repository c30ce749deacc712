package com.phaseforge.core.metrics;

import com.phaseforge.MutableClock;
import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.RunStatus;
import com.phaseforge.core.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MetricsTrackerTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MetricsTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tracker = new MetricsTracker("PF-1", clock);
    }

    @Test
    @DisplayName("a new run has no phases and a perfect score")
    void emptySnapshot() {
        RunMetrics snapshot = tracker.snapshot();

        assertEquals("PF-1", snapshot.runId());
        assertTrue(snapshot.phases().isEmpty());
        assertEquals(100, snapshot.hygieneScore());
        assertEquals("running", snapshot.status());
    }

    @Test
    @DisplayName("a finished phase carries its duration, workers and validation")
    void recordsPhase() {
        tracker.startPhase("build");
        tracker.recordWorker("build", "backend", Duration.ofMillis(1500), 0, 2);
        tracker.recordWorker("build", "frontend", Duration.ofMillis(800), 0, 0);
        clock.advance(Duration.ofSeconds(3));
        tracker.endPhase("build", ValidationStatus.PASS, 2);

        RunMetrics snapshot = tracker.snapshot();
        PhaseMetrics build = snapshot.phases().get("build");

        assertEquals(3.0, build.durationSeconds());
        assertEquals(1, build.attempts());
        assertEquals(2, build.artifactCount());
        assertEquals(1.5, build.workers().get("backend").durationSeconds());
        assertEquals(2, build.workers().get("backend").retryCount());
        assertEquals(2, snapshot.totalRetries());
        assertEquals(96, snapshot.hygieneScore());
    }

    @Test
    @DisplayName("an in-flight phase is not visible until it ends")
    void inFlightHidden() {
        tracker.startPhase("plan");
        tracker.recordWorker("plan", "planner", Duration.ofSeconds(1), 0, 0);

        assertTrue(tracker.snapshot().phases().isEmpty());
    }

    @Test
    @DisplayName("re-running a phase replaces its figures and bumps attempts")
    void rerunBumpsAttempts() {
        tracker.startPhase("plan");
        tracker.recordWorker("plan", "planner", Duration.ofSeconds(1), 1, 0);
        tracker.endPhase("plan", ValidationStatus.FAIL, 0);

        tracker.startPhase("plan");
        tracker.recordWorker("plan", "planner", Duration.ofSeconds(1), 0, 1);
        tracker.endPhase("plan", ValidationStatus.PASS, 1);

        PhaseMetrics plan = tracker.snapshot().phases().get("plan");
        assertEquals(2, plan.attempts());
        assertEquals(ValidationStatus.PASS, plan.validationStatus());
        assertEquals(0, plan.workers().get("planner").exitCode());
        assertEquals(1, tracker.snapshot().totalRetries());
    }

    @Test
    @DisplayName("recording a worker for a phase that is not running is an error")
    void recordOutsidePhase() {
        assertThrows(IllegalStateException.class,
                () -> tracker.recordWorker("plan", "planner", Duration.ZERO, 0, 0));
    }

    @Test
    @DisplayName("finish stamps the end time and final status")
    void finish() {
        clock.advance(Duration.ofSeconds(10));
        tracker.finish(RunStatus.COMPLETED);
        clock.advance(Duration.ofSeconds(10));

        RunMetrics snapshot = tracker.snapshot();
        assertEquals(START.plusSeconds(10), snapshot.endedAt());
        assertEquals(10.0, snapshot.durationSeconds());
        assertEquals("completed", snapshot.status());
    }

    @Test
    @DisplayName("continues from a saved snapshot")
    void resumesFromSnapshot() {
        tracker.startPhase("plan");
        tracker.recordWorker("plan", "planner", Duration.ofSeconds(1), 0, 1);
        tracker.endPhase("plan", ValidationStatus.PASS, 1);
        RunMetrics saved = tracker.snapshot();

        MetricsTracker resumed = new MetricsTracker(saved, clock);
        resumed.startPhase("build");
        resumed.endPhase("build", ValidationStatus.PASS, 0);

        RunMetrics snapshot = resumed.snapshot();
        assertEquals(START, snapshot.startedAt());
        assertEquals(2, snapshot.phases().size());
        assertEquals(1, snapshot.totalRetries());
    }
}
