package com.phaseforge.core.consensus;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.persistence.AtomicFiles;
import com.phaseforge.core.persistence.StatePersistenceException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Keeps an audit trail of approval decisions next to the approval requests.
 */
@Component
public class DecisionRecorder {

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final RunPaths paths;

    public DecisionRecorder(RunPaths paths) {
        this.paths = paths;
    }

    /**
     * Writes {@code DECISION_<phase>_<timestamp>.md}.
     *
     * @param reason may be null for approvals
     */
    public Path record(String runId, String phase, boolean approved, String reason, Instant decidedAt) {
        Path target = paths.consensusDir(runId)
                .resolve("DECISION_" + phase + "_" + FILE_STAMP.format(decidedAt) + ".md");

        StringBuilder md = new StringBuilder();
        md.append("# Decision: ").append(phase).append("\n\n");
        md.append("**Run:** `").append(runId).append("`\n\n");
        md.append("**Decided:** ").append(decidedAt).append("\n\n");
        md.append("**Decision:** ").append(approved ? "APPROVED" : "REJECTED").append("\n\n");
        if (reason != null && !reason.isBlank()) {
            md.append("**Reason:** ").append(reason).append("\n");
        }

        try {
            AtomicFiles.writeString(target, md.toString());
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to record decision for phase " + phase, e);
        }
        return target;
    }
}
