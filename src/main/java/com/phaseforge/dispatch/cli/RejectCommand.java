package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: phaseforge reject --reason "..."
 * <p>
 * The run stays on the rejected phase with status {@code needs_revision}, so this command
 * exits with {@link ExitCodes#NEEDS_ATTENTION} on success.
 */
@Command(name = "reject", mixinStandardHelpOptions = true, description = "Send the phase awaiting approval back for revision")
@Component
public class RejectCommand extends EngineCommand {

    @Mixin
    private RunOptions options = new RunOptions();

    @Option(names = "--reason", required = true, description = "Why the phase is rejected")
    private String reason;

    public RejectCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return options.json;
    }

    @Override
    protected int execute() {
        RunState state = engine.reject(options.resolveRunId(engine), reason);
        if (options.json) {
            printJson(state);
        } else {
            ConsoleOutput.warn("Rejected phase " + state.currentPhase() + ": " + reason);
            ConsoleOutput.status(state.status());
            ConsoleOutput.info("Rework, then: phaseforge resume --run " + state.runId());
        }
        return ExitCodes.forStatus(state.status());
    }
}
