package com.phaseforge.worker;

import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.BackoffCalculator;
import com.phaseforge.core.reliability.ErrorKind;
import com.phaseforge.core.reliability.RetryExecutor;
import com.phaseforge.core.reliability.RetryPolicy;
import com.phaseforge.core.reliability.TimeoutGuard;
import com.phaseforge.core.reliability.TransientErrorClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WorkerDispatcherTest {

    private LocalProcessExecutor localExecutor;
    private RemoteCallExecutor remoteExecutor;
    private TimeoutGuard timeoutGuard;
    private final List<Long> sleeps = new ArrayList<>();
    private WorkerDispatcher dispatcher;

    private final RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), 2.0, 0.0,
            RetryPolicy.DEFAULT_TRANSIENT_EXIT_CODES, List.of("rate limit"));
    private final WorkerContext context = new WorkerContext("PF-1", "build", Path.of("."), Map.of(), Map.of());

    @BeforeEach
    void setUp() {
        localExecutor = mock(LocalProcessExecutor.class);
        remoteExecutor = mock(RemoteCallExecutor.class);
        timeoutGuard = new TimeoutGuard();
        dispatcher = new WorkerDispatcher(localExecutor, remoteExecutor, timeoutGuard,
                new RetryExecutor(new BackoffCalculator(new Random(1)), sleeps::add),
                new TransientErrorClassifier());
    }

    @AfterEach
    void tearDown() {
        timeoutGuard.close();
    }

    private static WorkerSpec.Local local(Duration timeout) {
        return new WorkerSpec.Local("backend", "make backend", null, Map.of(), timeout);
    }

    private static WorkerOutcome exit(int code, String error) {
        return new WorkerOutcome("backend", false, List.of(), "", List.of(error), code, 5, 0, null);
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("a transient exit code twice then success reports two retries")
        void transientThenSuccess() {
            when(localExecutor.run(any(), any()))
                    .thenReturn(exit(75, "Exit code 75"))
                    .thenReturn(exit(75, "Exit code 75"))
                    .thenReturn(WorkerOutcome.succeeded("backend", List.of("build/backend.txt"), "ok", 5));

            WorkerOutcome outcome = dispatcher.dispatch(local(null), context, policy);

            assertTrue(outcome.success());
            assertEquals(2, outcome.retryCount());
            assertEquals(List.of("build/backend.txt"), outcome.artifacts());
            assertEquals(List.of(100L, 200L), sleeps);
            verify(localExecutor, times(3)).run(any(), any());
        }

        @Test
        @DisplayName("a permanent failure is not retried")
        void permanentFailure() {
            when(localExecutor.run(any(), any())).thenReturn(exit(1, "Exit code 1: compilation failed"));

            WorkerOutcome outcome = dispatcher.dispatch(local(null), context, policy);

            assertFalse(outcome.success());
            assertEquals(0, outcome.retryCount());
            assertEquals(ErrorKind.PERMANENT, outcome.failureKind());
            verify(localExecutor, times(1)).run(any(), any());
        }

        @Test
        @DisplayName("a worker that exits 124 itself is not retried unless the policy says so")
        void ownExit124NotRetried() {
            when(localExecutor.run(any(), any())).thenReturn(exit(124, "Exit code 124"));

            WorkerOutcome outcome = dispatcher.dispatch(local(null), context, policy);

            assertFalse(outcome.success());
            assertEquals(124, outcome.exitCode());
            assertEquals(ErrorKind.PERMANENT, outcome.failureKind());
            assertEquals(0, outcome.retryCount());
            verify(localExecutor, times(1)).run(any(), any());
        }

        @Test
        @DisplayName("exhausted retries return the last attempt's outcome")
        void exhausted() {
            when(localExecutor.run(any(), any()))
                    .thenReturn(exit(503, "first"))
                    .thenReturn(exit(503, "second"))
                    .thenReturn(exit(503, "third"));

            WorkerOutcome outcome = dispatcher.dispatch(local(null), context, policy);

            assertFalse(outcome.success());
            assertEquals(2, outcome.retryCount());
            assertEquals(List.of("third"), outcome.errors());
            assertEquals(ErrorKind.TRANSIENT_EXIT_CODE, outcome.failureKind());
        }

        @Test
        @DisplayName("a transient message in the output makes the failure retryable")
        void transientMessage() {
            when(localExecutor.run(any(), any()))
                    .thenReturn(exit(1, "Exit code 1: Rate limit reached"))
                    .thenReturn(WorkerOutcome.succeeded("backend", List.of(), "ok", 5));

            WorkerOutcome outcome = dispatcher.dispatch(local(null), context, policy);

            assertTrue(outcome.success());
            assertEquals(1, outcome.retryCount());
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        private WorkerOutcome slowRun() {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return WorkerOutcome.succeeded("backend", List.of(), "too late", 10_000);
        }

        @Test
        @DisplayName("an attempt over its timeout fails with exit 124 after the retries")
        void timeoutExhaustsRetries() {
            when(localExecutor.run(any(), any())).thenAnswer(invocation -> slowRun());

            WorkerOutcome outcome = dispatcher.dispatch(local(Duration.ofMillis(100)), context, policy);

            assertFalse(outcome.success());
            assertEquals(TransientErrorClassifier.TIMEOUT_EXIT_CODE, outcome.exitCode());
            assertEquals(ErrorKind.TIMEOUT, outcome.failureKind());
            assertEquals(2, outcome.retryCount());
            verify(localExecutor, times(3)).run(any(), any());
        }

        @Test
        @DisplayName("without retries a timeout fails after one attempt")
        void timeoutWithoutRetries() {
            when(localExecutor.run(any(), any())).thenAnswer(invocation -> slowRun());

            WorkerOutcome outcome = dispatcher.dispatch(local(Duration.ofMillis(100)), context, RetryPolicy.none());

            assertEquals(TransientErrorClassifier.TIMEOUT_EXIT_CODE, outcome.exitCode());
            assertEquals(0, outcome.retryCount());
        }
    }

    @Test
    @DisplayName("remote workers go to the remote executor")
    void remoteRouting() {
        var remote = new WorkerSpec.Remote("reviewer", "http://localhost:9000", "review", null, Map.of(), null);
        when(remoteExecutor.run(eq(remote), any()))
                .thenReturn(WorkerOutcome.succeeded("reviewer", List.of(), "LGTM", 5));

        WorkerOutcome outcome = dispatcher.dispatch(remote, context, policy);

        assertTrue(outcome.success());
        verifyNoInteractions(localExecutor);
    }

    @Test
    @DisplayName("an executor that throws is turned into a failed outcome")
    void executorThrows() {
        when(localExecutor.run(any(), any())).thenThrow(new IllegalStateException("boom"));

        WorkerOutcome outcome = dispatcher.dispatch(local(null), context, RetryPolicy.none());

        assertFalse(outcome.success());
        assertEquals(List.of("IllegalStateException: boom"), outcome.errors());
    }

    @Test
    void transientExitCodesIncludeHttpOverload() {
        assertTrue(Set.copyOf(RetryPolicy.DEFAULT_TRANSIENT_EXIT_CODES).containsAll(Set.of(429, 502, 503, 504)));
    }
}
