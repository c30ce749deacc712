package com.phaseforge.dispatch.cli;

import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: phaseforge runs
 * <p>
 * Lists known runs, most recently updated first.
 */
@Command(name = "runs", mixinStandardHelpOptions = true, description = "List runs")
@Component
public class RunsCommand extends EngineCommand {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = "--json", description = "Print machine-readable JSON instead of text")
    private boolean json;

    public RunsCommand(RunEngine engine) {
        super(engine);
    }

    @Override
    protected boolean jsonOutput() {
        return json;
    }

    @Override
    protected int execute() {
        List<RunState> runs = engine.listRuns();
        List<RunState> display = runs.size() > limit ? runs.subList(0, limit) : runs;
        if (json) {
            printJson(display);
            return ExitCodes.SUCCESS;
        }

        ConsoleOutput.printBanner();
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return ExitCodes.SUCCESS;
        }
        ConsoleOutput.info("Runs (" + display.size() + " of " + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-26s %-18s %-14s %s%n", "RUN ID", "STATUS", "PHASE", "UPDATED");
        System.out.println("  " + "-".repeat(80));
        for (RunState run : display) {
            System.out.printf("  %-26s %-18s %-14s %s%n", run.runId(), run.status().wireName(),
                    run.currentPhase() != null ? run.currentPhase() : "-", run.updatedAt());
        }
        return ExitCodes.SUCCESS;
    }
}
