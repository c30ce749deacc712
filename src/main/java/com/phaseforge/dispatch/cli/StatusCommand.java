package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command: phaseforge status
 * <p>
 * Shows the persisted state of a run along with its metrics. The exit code mirrors the run
 * status, so scripts can poll for runs that need attention.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show run status")
@Component
public class StatusCommand extends EngineCommand {

    @Mixin
    private RunOptions options = new RunOptions();

    public StatusCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return options.json;
    }

    @Override
    protected int execute() {
        String runId = options.resolveRunId(engine);
        RunState state = engine.status(runId);
        if (options.json) {
            printJson(state);
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.runState(state);
            engine.metrics(runId).ifPresent(ConsoleOutput::metrics);
        }
        return ExitCodes.forStatus(state.status());
    }
}
