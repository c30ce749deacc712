package com.phaseforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for phaseforge.
 * Routes to subcommands: start, advance, approve, reject, resume, status, runs, serve.
 */
@Command(
        name = "phaseforge",
        mixinStandardHelpOptions = true,
        version = "phaseforge 0.1.0",
        description = "Phase-oriented workflow engine with artifact checkpoints and approval gates",
        subcommands = {
                StartCommand.class,
                AdvanceCommand.class,
                ApproveCommand.class,
                RejectCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                RunsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PhaseforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        new CommandLine(this).usage(System.out);
    }
}
