package com.phaseforge.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link StateStore} keeping one JSON document per run under {@code <stateDir>/runs/}.
 * <p>
 * Writes go through a temp file and an atomic move, so a crash mid-write leaves the previous
 * snapshot intact.
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;

    public JsonFileStateStore(RunPaths paths) {
        this.paths = paths;
        this.objectMapper = PipelineJson.createMapper();
    }

    @Override
    public void save(RunState state) {
        Path target = paths.runFile(state.runId());
        try {
            AtomicFiles.writeString(target, objectMapper.writeValueAsString(state));
            log.debug("Saved run {} ({}) to {}", state.runId(), state.status(), target);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to save run " + state.runId() + " to " + target, e);
        }
    }

    @Override
    public Optional<RunState> load(String runId) {
        Path source = paths.runFile(runId);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(source.toFile(), RunState.class));
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read run " + runId + " from " + source, e);
        }
    }

    @Override
    public List<String> listRunIds() {
        Path dir = paths.runsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json") && !name.startsWith("."))
                    .map(name -> name.substring(0, name.length() - ".json".length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to list runs in " + dir, e);
        }
    }
}
