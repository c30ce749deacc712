package com.phaseforge.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PhaseforgeCommand phaseforgeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PhaseforgeCommand phaseforgeCommand, IFactory factory) {
        this.phaseforgeCommand = phaseforgeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server owns the JVM; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = commandLine(phaseforgeCommand, factory).execute(args);
    }

    /**
     * Usage errors exit with {@link ExitCodes#FAILURE}; picocli's default of 2 would read as a run
     * needing attention.
     */
    static CommandLine commandLine(PhaseforgeCommand root, IFactory factory) {
        CommandLine commandLine = new CommandLine(root, factory);
        applyFailureExitCodes(commandLine);
        return commandLine;
    }

    // picocli takes the exit code from the spec of the subcommand that failed
    private static void applyFailureExitCodes(CommandLine commandLine) {
        commandLine.getCommandSpec()
                .exitCodeOnInvalidInput(ExitCodes.FAILURE)
                .exitCodeOnExecutionException(ExitCodes.FAILURE);
        commandLine.getSubcommands().values().forEach(CliRunner::applyFailureExitCodes);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
