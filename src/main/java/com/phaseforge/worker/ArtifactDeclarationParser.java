package com.phaseforge.worker;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts artifact declarations from worker output.
 * <p>
 * Two line forms are recognized, anywhere in the output:
 * <pre>
 * ARTIFACT: docs/plan.md
 * ARTIFACTS: src/a.py, src/b.py
 * </pre>
 */
public final class ArtifactDeclarationParser {

    static final String SINGLE = "ARTIFACT:";
    static final String MULTIPLE = "ARTIFACTS:";

    private ArtifactDeclarationParser() {}

    /** Declared paths in order of appearance, without duplicates or blanks. */
    public static List<String> parse(String output) {
        if (output == null || output.isEmpty()) {
            return List.of();
        }
        Set<String> artifacts = new LinkedHashSet<>();
        for (String raw : output.split("\\R")) {
            String line = raw.strip();
            if (line.startsWith(MULTIPLE)) {
                for (String part : line.substring(MULTIPLE.length()).split(",")) {
                    addIfPresent(artifacts, part);
                }
            } else if (line.startsWith(SINGLE)) {
                addIfPresent(artifacts, line.substring(SINGLE.length()));
            }
        }
        return List.copyOf(artifacts);
    }

    /**
     * Rewrites absolute paths inside {@code projectRoot} as root-relative; other paths are kept.
     */
    public static List<String> relativize(List<String> artifacts, Path projectRoot) {
        List<String> result = new ArrayList<>(artifacts.size());
        Path root = projectRoot.toAbsolutePath().normalize();
        for (String artifact : artifacts) {
            result.add(relativize(artifact, root));
        }
        return List.copyOf(new LinkedHashSet<>(result));
    }

    private static String relativize(String artifact, Path root) {
        try {
            Path path = Path.of(artifact);
            if (path.isAbsolute()) {
                Path normalized = path.normalize();
                if (normalized.startsWith(root)) {
                    return root.relativize(normalized).toString().replace('\\', '/');
                }
            }
        } catch (InvalidPathException e) {
            return artifact;
        }
        return artifact;
    }

    private static void addIfPresent(Set<String> artifacts, String candidate) {
        String trimmed = candidate.strip();
        if (!trimmed.isEmpty()) {
            artifacts.add(trimmed);
        }
    }
}
