package com.phaseforge.dispatch.cli;

import com.phaseforge.core.model.PhaseMetrics;
import com.phaseforge.core.model.PhaseOutcome;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.RunState;
import com.phaseforge.core.model.RunStatus;
import com.phaseforge.core.model.ValidationResult;
import com.phaseforge.core.model.WorkerOutcome;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the phaseforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PHASEFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PHASEFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void runState(RunState state) {
        System.out.println();
        System.out.println("RUN " + state.runId());
        status(state.status());
        System.out.println("  Phase:     " + (state.currentPhase() != null ? state.currentPhase() : "-"));
        System.out.println("  Completed: " + (state.completedPhases().isEmpty()
                ? "-" : String.join(" -> ", state.completedPhases())));
        if (state.awaitingApproval()) {
            ConsoleOutput.warn("Awaiting approval of phase " + state.approvalPhase());
        }
        if (!state.metadata().isEmpty()) {
            System.out.println("  Params:    " + formatParams(state.metadata()));
        }
        for (Map.Entry<String, List<String>> entry : state.phaseArtifacts().entrySet()) {
            System.out.println("  Artifacts [" + entry.getKey() + "]: " + entry.getValue().size());
        }
        if (!state.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + state.errors().size() + "):");
            for (String e : state.errors()) {
                error("  " + e);
            }
        }
    }

    public static void status(RunStatus status) {
        String text = "Status: " + status.wireName();
        if (status == RunStatus.COMPLETED) {
            success(text);
        } else if (status.needsAttention()) {
            warn(text);
        } else {
            info(text);
        }
    }

    public static void phaseOutcome(PhaseOutcome outcome) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [PHASE " + outcome.phaseName() + "]|@"));
        for (WorkerOutcome worker : outcome.workerOutcomes()) {
            String mark = worker.success() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + mark + " " + worker.workerId()
                            + " (" + formatDuration(worker.durationMs()) + ", exit " + worker.exitCode()
                            + (worker.retryCount() > 0 ? ", " + worker.retryCount() + " retries" : "") + ")"));
            for (String e : worker.errors()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + e));
            }
        }
        ValidationResult validation = outcome.validation();
        if (validation != null && !validation.required().isEmpty()) {
            String color = switch (validation.status()) {
                case PASS -> "fg(green)";
                case PARTIAL -> "fg(yellow)";
                case FAIL -> "fg(red)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Artifacts: @|" + color + " " + validation.status().wireName().toUpperCase(Locale.ROOT) + "|@ "
                            + validation.found().size() + "/" + validation.required().size() + " patterns"));
            for (String missing : validation.missing()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) missing|@ " + missing));
            }
        }
        if (outcome.approvalPackagePath() != null) {
            warn("Approval requested: " + outcome.approvalPackagePath());
        }
    }

    public static void metrics(RunMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Metrics|@"));
        for (PhaseMetrics phase : m.phases().values()) {
            System.out.println(String.format(Locale.ROOT, "  %-14s %8.1fs  attempts %d  retries %d  %s",
                    phase.phase(), phase.durationSeconds(), phase.attempts(), phase.retries(),
                    phase.validationStatus() != null ? phase.validationStatus().wireName() : "-"));
        }
        System.out.println("  Retries: " + m.totalRetries());
        String scoreColor = m.hygieneScore() >= 80 ? "fg(green)" : m.hygieneScore() >= 50 ? "fg(yellow)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Hygiene: @|" + scoreColor + " " + m.hygieneScore() + "/100|@"));
    }

    private static String formatParams(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        params.forEach((k, v) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
