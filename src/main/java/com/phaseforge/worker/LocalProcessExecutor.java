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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a worker as a shell command in the project root.
 * <p>
 * stdout and stderr are captured into the worker's output directory; artifacts are read from
 * {@code ARTIFACT:}/{@code ARTIFACTS:} lines on stdout. Run context, run parameters
 * ({@code PHASEFORGE_PARAM_<KEY>}) and earlier phases' artifacts ({@code PHASEFORGE_ARTIFACTS_<PHASE>})
 * are exported as environment variables.
 */
@Component
public class LocalProcessExecutor implements WorkerExecutor<WorkerSpec.Local> {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutor.class);

    static final String STDOUT_FILE = "stdout.log";
    static final String STDERR_FILE = "stderr.log";

    private final RunPaths paths;
    private final WorkerRequestRenderer renderer;

    public LocalProcessExecutor(RunPaths paths, WorkerRequestRenderer renderer) {
        this.paths = paths;
        this.renderer = renderer;
    }

    @Override
    public WorkerOutcome run(WorkerSpec.Local spec, WorkerContext context) {
        long startNanos = System.nanoTime();
        String command;
        try {
            command = renderer.renderCommand(spec, context);
        } catch (RuntimeException e) {
            return WorkerOutcome.failed(spec.id(), 1, "Failed to render command: " + e.getMessage(),
                    null, elapsedMs(startNanos), ErrorKind.PERMANENT);
        }

        Path workDir = spec.workingDirectory() != null && !spec.workingDirectory().isBlank()
                ? context.projectRoot().resolve(spec.workingDirectory())
                : context.projectRoot();
        Path outputDir = paths.workerOutputDir(spec.id(), context.phase());
        Path stdoutFile = outputDir.resolve(STDOUT_FILE);
        Path stderrFile = outputDir.resolve(STDERR_FILE);

        Process process;
        try {
            Files.createDirectories(outputDir);
            ProcessBuilder builder = new ProcessBuilder(shellCommand(command))
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            builder.environment().putAll(environmentFor(spec, context));
            log.info("Starting local worker {}: {}", spec.id(), command);
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to start worker {}: {}", spec.id(), e.getMessage());
            return WorkerOutcome.failed(spec.id(), 1, "Failed to start process: " + e.getMessage(),
                    null, elapsedMs(startNanos), ErrorKind.PERMANENT);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted, process killed", spec.id());
            return WorkerOutcome.failed(spec.id(), TransientErrorClassifier.TIMEOUT_EXIT_CODE,
                    "Interrupted, process killed", readQuietly(stdoutFile), elapsedMs(startNanos),
                    ErrorKind.TIMEOUT);
        }

        long durationMs = elapsedMs(startNanos);
        String stdout = readQuietly(stdoutFile);
        List<String> artifacts = ArtifactDeclarationParser.relativize(
                ArtifactDeclarationParser.parse(stdout), context.projectRoot());

        if (exitCode == 0) {
            log.info("Worker {} finished in {}ms, {} artifact(s) declared", spec.id(), durationMs, artifacts.size());
            return WorkerOutcome.succeeded(spec.id(), artifacts, stdout, durationMs);
        }

        String stderr = readQuietly(stderrFile);
        String detail = stderr.isBlank() ? "" : ": " + lastLine(stderr);
        log.warn("Worker {} exited with code {} after {}ms", spec.id(), exitCode, durationMs);
        return new WorkerOutcome(spec.id(), false, artifacts, stdout + "\n" + stderr,
                List.of("Exit code " + exitCode + detail), exitCode, durationMs, 0, null);
    }

    Map<String, String> environmentFor(WorkerSpec.Local spec, WorkerContext context) {
        Map<String, String> env = new LinkedHashMap<>(spec.environment());
        env.put("PHASEFORGE_RUN_ID", context.runId());
        env.put("PHASEFORGE_PHASE", context.phase());
        env.put("PHASEFORGE_WORKER", spec.id());
        env.put("PHASEFORGE_PROJECT_ROOT", context.projectRoot().toString());
        context.metadata().forEach((key, value) ->
                env.put("PHASEFORGE_PARAM_" + envSuffix(key), value));
        context.priorArtifacts().forEach((phase, artifacts) ->
                env.put("PHASEFORGE_ARTIFACTS_" + envSuffix(phase), String.join(",", artifacts)));
        return env;
    }

    static String envSuffix(String phase) {
        return phase.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    static List<String> shellCommand(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        return windows ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
    }

    private static String readQuietly(Path file) {
        try {
            return Files.isRegularFile(file)
                    ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8)
                    : "";
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static String lastLine(String text) {
        String[] lines = text.strip().split("\\R");
        return lines[lines.length - 1];
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
