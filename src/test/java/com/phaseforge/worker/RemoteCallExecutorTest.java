package com.phaseforge.worker;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.ErrorKind;
import com.phaseforge.core.reliability.TransientErrorClassifier;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RemoteCallExecutorTest {

    @TempDir
    Path root;

    private RunPaths paths;
    private RemoteCallClient client;
    private RemoteCallExecutor executor;

    @BeforeEach
    void setUp() {
        paths = RunPaths.of(root);
        client = mock(RemoteCallClient.class);
        executor = new RemoteCallExecutor(paths, new PassThroughRequestRenderer(), client);
    }

    private static WorkerSpec.Remote reviewer() {
        return new WorkerSpec.Remote("reviewer", "http://localhost:9000/review", "Review the build",
                null, Map.of("Authorization", "Bearer t"), null);
    }

    private WorkerContext context() {
        return new WorkerContext("PF-1", "review", root, Map.of("build", List.of("build/backend.txt")), Map.of());
    }

    @Test
    @DisplayName("a 2xx response succeeds and both transcripts are written")
    void successWritesTranscripts() throws Exception {
        when(client.call(any())).thenReturn(
                new RemoteCallClient.RemoteResponse(200, "Looks good\nARTIFACT: docs/REVIEW.md\n"));

        WorkerOutcome outcome = executor.run(reviewer(), context());

        assertTrue(outcome.success());
        assertEquals(List.of("docs/REVIEW.md"), outcome.artifacts());
        Path dir = paths.workerOutputDir("reviewer", "review");
        assertEquals("Review the build", Files.readString(dir.resolve(RemoteCallExecutor.REQUEST_FILE)));
        assertTrue(Files.readString(dir.resolve(RemoteCallExecutor.RESPONSE_FILE)).contains("ARTIFACT: docs/REVIEW.md"));
    }

    @Test
    @DisplayName("the call carries run context, headers and prior artifacts")
    void callPayload() throws Exception {
        when(client.call(any())).thenReturn(new RemoteCallClient.RemoteResponse(200, ""));

        executor.run(reviewer(), context());

        var captor = ArgumentCaptor.forClass(RemoteCallClient.RemoteCall.class);
        verify(client).call(captor.capture());
        var call = captor.getValue();
        assertEquals("PF-1", call.runId());
        assertEquals("review", call.phase());
        assertEquals("Bearer t", call.headers().get("Authorization"));
        assertEquals(List.of("build/backend.txt"), call.priorArtifacts().get("build"));
    }

    @Test
    @DisplayName("a non-2xx status becomes the exit code")
    void httpError() throws Exception {
        when(client.call(any())).thenReturn(new RemoteCallClient.RemoteResponse(503, "overloaded"));

        WorkerOutcome outcome = executor.run(reviewer(), context());

        assertFalse(outcome.success());
        assertEquals(503, outcome.exitCode());
        assertEquals(List.of("HTTP 503"), outcome.errors());
    }

    @Test
    @DisplayName("connection and timeout failures are classified")
    void transportFailures() throws Exception {
        when(client.call(any())).thenThrow(new ConnectException("refused"));
        assertEquals(ErrorKind.CONNECTION, executor.run(reviewer(), context()).failureKind());

        reset(client);
        when(client.call(any())).thenThrow(new HttpTimeoutException("slow"));
        WorkerOutcome timedOut = executor.run(reviewer(), context());
        assertEquals(ErrorKind.TIMEOUT, timedOut.failureKind());
        assertEquals(TransientErrorClassifier.TIMEOUT_EXIT_CODE, timedOut.exitCode());
    }

    @Nested
    @DisplayName("Against a live endpoint")
    class LiveEndpoint {

        private static final String RESPONSE_BODY =
                "{\"output\":\"done\\nARTIFACT: docs/REVIEW.md\",\"model\":\"m1\",\"usage\":{\"tokens\":5}}";

        private HttpServer server;
        private final AtomicReference<String> received = new AtomicReference<>();

        @BeforeEach
        void startServer() throws Exception {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/review", exchange -> {
                received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                byte[] bytes = RESPONSE_BODY.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        @Test
        @DisplayName("keeps the raw response body and the sent payload verbatim")
        void transcriptsAreVerbatim() throws Exception {
            var live = new RemoteCallExecutor(paths, new PassThroughRequestRenderer(), new HttpRemoteCallClient());
            String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/review";
            var spec = new WorkerSpec.Remote("reviewer", endpoint, "Review the build", null, Map.of(), null);

            WorkerOutcome outcome = live.run(spec, context());

            assertTrue(outcome.success());
            assertEquals(List.of("docs/REVIEW.md"), outcome.artifacts());
            assertEquals("done\nARTIFACT: docs/REVIEW.md", outcome.notes());

            Path dir = paths.workerOutputDir("reviewer", "review");
            assertEquals(RESPONSE_BODY, Files.readString(dir.resolve(RemoteCallExecutor.RESPONSE_FILE)));
            assertEquals("Review the build", Files.readString(dir.resolve(RemoteCallExecutor.REQUEST_FILE)));
            assertEquals(received.get(), Files.readString(dir.resolve(RemoteCallExecutor.ENVELOPE_FILE)));
            assertTrue(received.get().contains("\"run_id\":\"PF-1\""));
            assertTrue(received.get().contains("\"build\":[\"build/backend.txt\"]"));
        }
    }
}
