package com.phaseforge.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phaseforge.core.PipelineException;
import com.phaseforge.core.config.WorkflowConfigurationException;
import com.phaseforge.core.engine.InvalidStateException;
import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.persistence.PipelineJson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base for subcommands backed by the {@link RunEngine}.
 * <p>
 * Engine failures are reported on the console, or as a JSON error object under {@code --json}, and
 * turned into {@link ExitCodes#FAILURE}; they never escape as stack traces.
 */
abstract class EngineCommand implements Callable<Integer> {

    private static final ObjectMapper JSON = PipelineJson.createMapper();

    protected final RunEngine engine;

    protected EngineCommand(RunEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (WorkflowConfigurationException e) {
            if (jsonOutput()) {
                printError(e, e.getProblems());
            } else {
                ConsoleOutput.error(e.getMessage());
                e.getProblems().forEach(p -> ConsoleOutput.error("  " + p));
            }
            return ExitCodes.FAILURE;
        } catch (PipelineException e) {
            if (jsonOutput()) {
                printError(e, List.of());
            } else {
                ConsoleOutput.error(e.getMessage());
            }
            return ExitCodes.FAILURE;
        }
    }

    protected abstract int execute();

    /** Whether the user asked for machine-readable output. */
    protected abstract boolean jsonOutput();

    private static void printError(PipelineException e, List<String> problems) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", e.getMessage());
        error.put("type", e.getClass().getSimpleName());
        if (e instanceof InvalidStateException invalid) {
            error.put("status", invalid.getStatus().wireName());
        }
        if (!problems.isEmpty()) {
            error.put("problems", problems);
        }
        printJson(error);
    }

    protected static void printJson(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
