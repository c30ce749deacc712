package com.phaseforge.core.model;

import java.nio.file.Path;

/**
 * A rendered approval request for a phase awaiting a decision.
 *
 * @param ready   whether every worker succeeded and validation passed
 * @param content the markdown document
 * @param path    where the document was written
 */
public record ApprovalPackage(String runId, String phase, boolean ready, String content, Path path) {
}
