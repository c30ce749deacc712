package com.phaseforge.core.consensus;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.ApprovalPackage;
import com.phaseforge.core.model.PhaseOutcome;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.model.ValidationResult;
import com.phaseforge.core.model.ValidationStatus;
import com.phaseforge.core.model.WorkerOutcome;
import com.phaseforge.core.persistence.AtomicFiles;
import com.phaseforge.core.persistence.StatePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Emits the approval request for a phase that needs a decision before the run may continue.
 * <p>
 * The document is a pure function of its inputs, so rendering the same outcome twice yields
 * identical bytes. The gate only presents evidence; approving or rejecting is up to the caller.
 */
@Component
public class ConsensusGate {

    private static final Logger log = LoggerFactory.getLogger(ConsensusGate.class);

    static final List<String> REVIEW_CHECKLIST = List.of(
            "All required artifacts are present and complete",
            "Worker output matches the intent of the phase",
            "No unresolved errors or warnings remain",
            "The next phase can start from these artifacts");

    private final RunPaths paths;

    public ConsensusGate(RunPaths paths) {
        this.paths = paths;
    }

    /**
     * Renders the approval package for {@code outcome} and writes it to
     * {@code <stateDir>/consensus/<runId>/REQUEST_<phase>.md}.
     */
    public ApprovalPackage buildApprovalPackage(String runId, PhaseOutcome outcome, RunMetrics metrics) {
        boolean ready = outcome.success()
                && outcome.validation() != null
                && outcome.validation().status() == ValidationStatus.PASS;
        String content = render(runId, outcome, metrics, ready);
        Path target = requestPath(runId, outcome.phaseName());
        try {
            AtomicFiles.writeString(target, content);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to write approval request " + target, e);
        }
        log.info("Approval requested for phase {} of run {}: {}", outcome.phaseName(), runId, paths.relative(target));
        return new ApprovalPackage(runId, outcome.phaseName(), ready, content, target);
    }

    public Path requestPath(String runId, String phase) {
        return paths.consensusDir(runId).resolve("REQUEST_" + phase + ".md");
    }

    String render(String runId, PhaseOutcome outcome, RunMetrics metrics, boolean ready) {
        ValidationResult validation = outcome.validation();
        StringBuilder md = new StringBuilder();

        md.append("# Approval Request: ").append(outcome.phaseName()).append("\n\n");
        md.append("**Run:** `").append(runId).append("`\n\n");
        md.append("**Status:** ").append(ready ? "READY FOR REVIEW" : "NEEDS ATTENTION").append("\n\n");
        if (outcome.completedAt() != null) {
            md.append("**Phase finished:** ").append(outcome.completedAt()).append("\n\n");
        }

        int artifactCount = validation != null ? validation.matchedFiles().size() : 0;
        long succeeded = outcome.workerOutcomes().stream().filter(WorkerOutcome::success).count();
        md.append("## Summary\n\n");
        md.append("| Phase | Workers | Artifacts | Validation |\n");
        md.append("|-------|---------|-----------|------------|\n");
        md.append("| ").append(outcome.phaseName())
                .append(" | ").append(succeeded).append('/').append(outcome.workerOutcomes().size())
                .append(" | ").append(artifactCount)
                .append(" | ").append(validation != null ? validation.status().wireName().toUpperCase(Locale.ROOT) : "N/A")
                .append(" |\n\n");

        md.append("## Workers\n\n");
        if (outcome.workerOutcomes().isEmpty()) {
            md.append("_No workers configured._\n");
        }
        for (WorkerOutcome worker : outcome.workerOutcomes()) {
            md.append("- ").append(worker.success() ? "[ok] " : "[failed] ").append('`').append(worker.workerId()).append('`')
                    .append(String.format(Locale.ROOT, " - %.1fs", worker.durationMs() / 1000.0))
                    .append(", ").append(worker.artifacts().size()).append(" artifact(s)")
                    .append(", ").append(worker.retryCount()).append(" retr").append(worker.retryCount() == 1 ? "y" : "ies")
                    .append(", exit ").append(worker.exitCode())
                    .append('\n');
            for (String error : worker.errors()) {
                md.append("  - error: ").append(error).append('\n');
            }
        }
        md.append('\n');

        if (validation != null) {
            md.append("## Artifacts\n\n");
            appendList(md, "Required", validation.required());
            appendList(md, "Found", validation.found());
            appendList(md, "Missing", validation.missing());
            appendList(md, "Files", validation.matchedFiles());
        }

        md.append("## Metrics\n\n");
        if (metrics != null) {
            md.append("- Total retries: ").append(metrics.totalRetries()).append('\n');
            md.append("- Hygiene score: ").append(metrics.hygieneScore()).append("/100\n");
        }
        md.append("- JSON: `").append(paths.relative(paths.metricsJson(runId))).append("`\n");
        md.append("- Prometheus: `").append(paths.relative(paths.metricsProm(runId))).append("`\n\n");

        md.append("## Reviewer Checklist\n\n");
        for (String item : REVIEW_CHECKLIST) {
            md.append("- [ ] ").append(item).append('\n');
        }
        md.append('\n');

        md.append("## Decision\n\n");
        md.append("Approve:  `phaseforge approve --run ").append(runId).append("`\n\n");
        md.append("Reject:   `phaseforge reject --run ").append(runId).append(" --reason \"<why>\"`\n");
        return md.toString();
    }

    private static void appendList(StringBuilder md, String title, List<String> items) {
        md.append("**").append(title).append(":**");
        if (items.isEmpty()) {
            md.append(" none\n\n");
            return;
        }
        md.append('\n');
        for (String item : items) {
            md.append("- `").append(item).append("`\n");
        }
        md.append('\n');
    }
}
