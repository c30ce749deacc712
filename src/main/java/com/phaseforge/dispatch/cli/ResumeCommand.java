package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command: phaseforge resume
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Return a run that needs revision to running")
@Component
public class ResumeCommand extends EngineCommand {

    @Mixin
    private RunOptions options = new RunOptions();

    public ResumeCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return options.json;
    }

    @Override
    protected int execute() {
        RunState state = engine.resume(options.resolveRunId(engine));
        if (options.json) {
            printJson(state);
        } else {
            ConsoleOutput.success("Resumed run " + state.runId() + " at phase " + state.currentPhase());
            ConsoleOutput.info("Next: phaseforge advance --run " + state.runId());
        }
        return ExitCodes.forStatus(state.status());
    }
}
