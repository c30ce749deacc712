package com.phaseforge.worker;

import com.phaseforge.core.model.WorkerSpec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sends the configured command unchanged; remote requests come from the inline text or, when
 * set, from the request file under the project root.
 */
public class PassThroughRequestRenderer implements WorkerRequestRenderer {

    @Override
    public String renderCommand(WorkerSpec.Local spec, WorkerContext context) {
        return spec.command();
    }

    @Override
    public String renderRequest(WorkerSpec.Remote spec, WorkerContext context) {
        if (spec.requestFile() == null || spec.requestFile().isBlank()) {
            return spec.request();
        }
        Path file = context.projectRoot().resolve(spec.requestFile());
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read request file " + file, e);
        }
    }
}
