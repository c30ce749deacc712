package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command: phaseforge approve
 */
@Command(name = "approve", mixinStandardHelpOptions = true, description = "Approve the phase awaiting approval")
@Component
public class ApproveCommand extends EngineCommand {

    @Mixin
    private RunOptions options = new RunOptions();

    public ApproveCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return options.json;
    }

    @Override
    protected int execute() {
        RunState state = engine.approve(options.resolveRunId(engine));
        if (options.json) {
            printJson(state);
        } else {
            ConsoleOutput.success("Approved " + state.completedPhases().get(state.completedPhases().size() - 1));
            ConsoleOutput.status(state.status());
            if (state.currentPhase() != null) {
                ConsoleOutput.info("Next phase: " + state.currentPhase());
            }
        }
        return ExitCodes.forStatus(state.status());
    }
}
