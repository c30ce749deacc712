package com.phaseforge.core.checkpoint;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.ValidationResult;
import com.phaseforge.core.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Checks that a phase produced the artifacts it declares.
 * <p>
 * Each required pattern is a glob relative to the root directory. A pattern counts as found only
 * when it matches at least one existing regular file with non-zero size. The check reads the file
 * system and nothing else, so repeated calls on an unchanged tree return equal results.
 * <p>
 * The engine's state directory and {@code .git} directories are never scanned.
 */
public class CheckpointValidator {

    private static final Logger log = LoggerFactory.getLogger(CheckpointValidator.class);

    private static final String GIT_DIR = ".git";

    // null: the default state directory under whichever root is validated
    private final Path stateDir;

    public CheckpointValidator() {
        this(null);
    }

    /**
     * @param stateDir the engine's state directory, wherever it sits below the root
     */
    public CheckpointValidator(Path stateDir) {
        this.stateDir = stateDir != null ? stateDir.toAbsolutePath().normalize() : null;
    }

    public ValidationResult validate(List<String> patterns, Path root) {
        if (patterns == null || patterns.isEmpty()) {
            return new ValidationResult(ValidationStatus.PASS, List.of(), List.of(), List.of(), List.of());
        }

        List<Path> candidates = listNonEmptyFiles(root);
        FileSystem fs = root.getFileSystem();

        List<String> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        TreeSet<String> matchedFiles = new TreeSet<>();

        for (String pattern : patterns) {
            List<PathMatcher> matchers = matchersFor(fs, pattern);
            boolean matched = false;
            for (Path candidate : candidates) {
                if (matchers.stream().anyMatch(m -> m.matches(candidate))) {
                    matchedFiles.add(toPortable(candidate));
                    matched = true;
                }
            }
            if (matched) {
                found.add(pattern);
            } else {
                missing.add(pattern);
            }
        }

        ValidationStatus status;
        if (missing.isEmpty()) {
            status = ValidationStatus.PASS;
        } else if (found.isEmpty()) {
            status = ValidationStatus.FAIL;
        } else {
            status = ValidationStatus.PARTIAL;
        }

        log.debug("Validated {} pattern(s) under {}: {} (missing {})", patterns.size(), root, status, missing);
        return new ValidationResult(status, patterns, found, missing, List.copyOf(matchedFiles));
    }

    /**
     * A leading {@code **}{@code /} also matches files directly in the root, which plain
     * {@link PathMatcher} globs do not.
     */
    private static List<PathMatcher> matchersFor(FileSystem fs, String pattern) {
        String normalized = pattern.strip().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        List<PathMatcher> matchers = new ArrayList<>();
        matchers.add(fs.getPathMatcher("glob:" + normalized));
        if (normalized.startsWith("**/")) {
            matchers.add(fs.getPathMatcher("glob:" + normalized.substring(3)));
        }
        return matchers;
    }

    private List<Path> listNonEmptyFiles(Path root) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return files;
        }
        Path excluded = stateDir != null
                ? stateDir
                : root.resolve(RunPaths.DEFAULT_STATE_DIR).toAbsolutePath().normalize();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (GIT_DIR.equals(dir.getFileName().toString())
                            || dir.toAbsolutePath().normalize().equals(excluded)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && attrs.size() > 0) {
                        files.add(root.relativize(file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        return files;
    }

    private static String toPortable(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
