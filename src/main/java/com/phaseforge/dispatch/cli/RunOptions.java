package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import picocli.CommandLine.Option;

/**
 * Options shared by every command that acts on an existing run.
 */
public class RunOptions {

    @Option(names = {"--run", "-r"}, description = "Run ID (default: most recently updated run)")
    String runId;

    @Option(names = "--json", description = "Print machine-readable JSON instead of text")
    boolean json;

    String resolveRunId(RunEngine engine) {
        return runId != null && !runId.isBlank() ? runId : engine.latestRunId();
    }
}
