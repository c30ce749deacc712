package com.phaseforge.worker;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.ErrorKind;
import com.phaseforge.core.reliability.TransientErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a worker by calling its remote endpoint.
 * <p>
 * The worker's output directory keeps an audit trail of the exchange: the rendered request as
 * {@code request.md}, the payload actually sent as {@code request.json} and the response body exactly
 * as received as {@code response.md}. Artifacts are read from the extracted answer. A non-2xx status
 * becomes the outcome's exit code.
 */
@Component
public class RemoteCallExecutor implements WorkerExecutor<WorkerSpec.Remote> {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallExecutor.class);

    static final String REQUEST_FILE = "request.md";
    static final String ENVELOPE_FILE = "request.json";
    static final String RESPONSE_FILE = "response.md";

    private final RunPaths paths;
    private final WorkerRequestRenderer renderer;
    private final RemoteCallClient client;

    public RemoteCallExecutor(RunPaths paths, WorkerRequestRenderer renderer, RemoteCallClient client) {
        this.paths = paths;
        this.renderer = renderer;
        this.client = client;
    }

    @Override
    public WorkerOutcome run(WorkerSpec.Remote spec, WorkerContext context) {
        long startNanos = System.nanoTime();
        Path outputDir = paths.workerOutputDir(spec.id(), context.phase());

        String request;
        try {
            request = renderer.renderRequest(spec, context);
        } catch (RuntimeException e) {
            return WorkerOutcome.failed(spec.id(), 1, "Failed to render request: " + e.getMessage(),
                    null, elapsedMs(startNanos), ErrorKind.PERMANENT);
        }
        writeTranscript(outputDir.resolve(REQUEST_FILE), request);

        RemoteCallClient.RemoteCall call = new RemoteCallClient.RemoteCall(URI.create(spec.endpoint()),
                spec.headers(), context.runId(), context.phase(), spec.id(), request, context.priorArtifacts());
        String envelope = client.envelope(call);
        if (envelope != null) {
            writeTranscript(outputDir.resolve(ENVELOPE_FILE), envelope);
        }

        RemoteCallClient.RemoteResponse response;
        try {
            log.info("Calling remote worker {} at {}", spec.id(), spec.endpoint());
            response = client.call(call);
        } catch (HttpTimeoutException e) {
            return WorkerOutcome.failed(spec.id(), TransientErrorClassifier.TIMEOUT_EXIT_CODE,
                    "Request timed out: " + e.getMessage(), null, elapsedMs(startNanos), ErrorKind.TIMEOUT);
        } catch (IOException e) {
            log.warn("Remote worker {} unreachable: {}", spec.id(), e.getMessage());
            return WorkerOutcome.failed(spec.id(), 1, "Connection failed: " + e.getMessage(),
                    null, elapsedMs(startNanos), ErrorKind.CONNECTION);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerOutcome.failed(spec.id(), TransientErrorClassifier.TIMEOUT_EXIT_CODE,
                    "Interrupted", null, elapsedMs(startNanos), ErrorKind.TIMEOUT);
        }

        String body = response.body() != null ? response.body() : "";
        String output = response.output() != null ? response.output() : body;
        writeTranscript(outputDir.resolve(RESPONSE_FILE), body);
        long durationMs = elapsedMs(startNanos);

        List<String> artifacts = ArtifactDeclarationParser.relativize(
                ArtifactDeclarationParser.parse(output), context.projectRoot());

        if (response.isSuccess()) {
            log.info("Remote worker {} answered in {}ms, {} artifact(s) declared", spec.id(), durationMs, artifacts.size());
            return WorkerOutcome.succeeded(spec.id(), artifacts, output, durationMs);
        }
        log.warn("Remote worker {} returned HTTP {}", spec.id(), response.statusCode());
        return new WorkerOutcome(spec.id(), false, artifacts, output,
                List.of("HTTP " + response.statusCode()), response.statusCode(), durationMs, 0, null);
    }

    private void writeTranscript(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            log.warn("Could not write transcript {}: {}", paths.relative(file), e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
