package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: phaseforge start [--param key=value]...
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a new run at the first phase")
@Component
public class StartCommand extends EngineCommand {

    @Option(names = {"--param", "-p"}, description = "Request parameter kept with the run (repeatable)")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = "--json", description = "Print machine-readable JSON instead of text")
    private boolean json;

    public StartCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return json;
    }

    @Override
    protected int execute() {
        RunState state = engine.start(params);
        if (json) {
            printJson(state);
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.success("Started run " + state.runId() + " at phase " + state.currentPhase());
            ConsoleOutput.info("Next: phaseforge advance --run " + state.runId());
        }
        return ExitCodes.SUCCESS;
    }
}
