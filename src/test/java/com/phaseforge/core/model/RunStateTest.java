package com.phaseforge.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phaseforge.core.persistence.PipelineJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunStateTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2026-03-01T10:05:00Z");

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("a started run is running on its first phase")
        void started() {
            RunState state = RunState.started("PF-1", "plan", Map.of("ticket", "ABC-1"), T0);

            assertEquals(RunStatus.RUNNING, state.status());
            assertEquals("plan", state.currentPhase());
            assertTrue(state.completedPhases().isEmpty());
            assertEquals(T0, state.createdAt());
            assertEquals(T0, state.updatedAt());
            assertEquals("ABC-1", state.metadata().get("ticket"));
        }

        @Test
        @DisplayName("completing a phase moves the cursor and records the phase once")
        void phaseCompleted() {
            RunState state = RunState.started("PF-1", "plan", Map.of(), T0)
                    .withPhaseCompleted("build", T1);

            assertEquals("build", state.currentPhase());
            assertEquals(List.of("plan"), state.completedPhases());
            assertEquals(RunStatus.RUNNING, state.status());
            assertEquals(T1, state.updatedAt());
            assertEquals(T0, state.createdAt());
        }

        @Test
        @DisplayName("completing the last phase completes the run")
        void lastPhaseCompletesRun() {
            RunState state = RunState.started("PF-1", "plan", Map.of(), T0)
                    .withPhaseCompleted(null, T1);

            assertTrue(state.isCompleted());
            assertNull(state.currentPhase());
        }

        @Test
        @DisplayName("approval pending and cleared")
        void approval() {
            RunState pending = RunState.started("PF-1", "review", Map.of(), T0)
                    .withApprovalPending("review", T1);

            assertEquals(RunStatus.AWAITING_APPROVAL, pending.status());
            assertTrue(pending.awaitingApproval());
            assertEquals("review", pending.approvalPhase());

            RunState cleared = pending.withApprovalCleared(T1);
            assertFalse(cleared.awaitingApproval());
            assertNull(cleared.approvalPhase());
        }

        @Test
        @DisplayName("errors accumulate and collections are immutable")
        void errorsAccumulate() {
            RunState state = RunState.started("PF-1", "plan", Map.of(), T0)
                    .withError("first", T1)
                    .withErrors(List.of("second", "third"), T1);

            assertEquals(List.of("first", "second", "third"), state.errors());
            assertThrows(UnsupportedOperationException.class, () -> state.errors().add("x"));
        }
    }

    @Test
    @DisplayName("serializes with snake_case fields and reads back equal")
    void jsonRoundTrip() throws Exception {
        ObjectMapper mapper = PipelineJson.createMapper();
        RunState state = RunState.started("PF-1", "plan", Map.of("ticket", "ABC-1"), T0)
                .withPhaseArtifacts("plan", List.of("docs/PLAN.md"), T1)
                .withPhaseCompleted("review", T1)
                .withApprovalPending("review", T1);

        String json = mapper.writeValueAsString(state);

        assertTrue(json.contains("\"run_id\""));
        assertTrue(json.contains("\"awaiting_approval\""));
        assertTrue(json.contains("\"status\" : \"awaiting_approval\""));
        assertFalse(json.contains("completed\" : false"), "derived flags are not persisted");
        assertEquals(state, mapper.readValue(json, RunState.class));
    }
}
