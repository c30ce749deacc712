package com.phaseforge.worker;

import com.phaseforge.core.model.WorkerSpec;

/**
 * Turns a worker's configured command or request into the text actually sent.
 * <p>
 * This is the seam for context-aware prompt construction; the default implementation
 * ({@link PassThroughRequestRenderer}) sends the configuration as written.
 */
public interface WorkerRequestRenderer {

    String renderCommand(WorkerSpec.Local spec, WorkerContext context);

    String renderRequest(WorkerSpec.Remote spec, WorkerContext context);
}
