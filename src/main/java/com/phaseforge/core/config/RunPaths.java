package com.phaseforge.core.config;

import java.nio.file.Path;

/**
 * File layout of the engine's own state under the project root.
 *
 * <pre>
 * &lt;root&gt;/&lt;stateDir&gt;/runs/&lt;runId&gt;.json
 * &lt;root&gt;/&lt;stateDir&gt;/consensus/&lt;runId&gt;/REQUEST_&lt;phase&gt;.md
 * &lt;root&gt;/&lt;stateDir&gt;/metrics/run_&lt;runId&gt;.json|.prom
 * &lt;root&gt;/&lt;stateDir&gt;/worker_outputs/&lt;worker&gt;/&lt;phase&gt;/
 * </pre>
 */
public record RunPaths(Path projectRoot, String stateDirName) {

    public static final String DEFAULT_STATE_DIR = ".phaseforge";

    public static RunPaths of(Path projectRoot) {
        return new RunPaths(projectRoot, DEFAULT_STATE_DIR);
    }

    public Path stateDir() {
        return projectRoot.resolve(stateDirName);
    }

    public Path runsDir() {
        return stateDir().resolve("runs");
    }

    public Path runFile(String runId) {
        return runsDir().resolve(runId + ".json");
    }

    public Path consensusDir(String runId) {
        return stateDir().resolve("consensus").resolve(runId);
    }

    public Path metricsDir() {
        return stateDir().resolve("metrics");
    }

    public Path metricsJson(String runId) {
        return metricsDir().resolve("run_" + runId + ".json");
    }

    public Path metricsProm(String runId) {
        return metricsDir().resolve("run_" + runId + ".prom");
    }

    public Path workerOutputDir(String workerId, String phase) {
        return stateDir().resolve("worker_outputs").resolve(workerId).resolve(phase);
    }

    /** Path relative to the project root with forward slashes, for display and state files. */
    public String relative(Path path) {
        return projectRoot.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
