package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.PhaseOutcome;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command: phaseforge advance
 * <p>
 * Executes the run's current phase. Exits with {@link ExitCodes#NEEDS_ATTENTION} when the phase
 * failed or is waiting for approval.
 */
@Command(name = "advance", mixinStandardHelpOptions = true, description = "Execute the current phase of a run")
@Component
public class AdvanceCommand extends EngineCommand {

    @Mixin
    private RunOptions options = new RunOptions();

    public AdvanceCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return options.json;
    }

    @Override
    protected int execute() {
        String runId = options.resolveRunId(engine);
        PhaseOutcome outcome = engine.advance(runId);
        RunState state = engine.status(runId);
        if (options.json) {
            printJson(outcome);
        } else {
            ConsoleOutput.phaseOutcome(outcome);
            System.out.println();
            ConsoleOutput.status(state.status());
            if (!outcome.success()) {
                state.errors().forEach(e -> ConsoleOutput.error("  " + e));
                ConsoleOutput.info("Fix the problems, then: phaseforge resume --run " + runId);
            } else if (state.currentPhase() != null && !state.awaitingApproval()) {
                ConsoleOutput.info("Next phase: " + state.currentPhase());
            }
        }
        return ExitCodes.forStatus(state.status());
    }
}
