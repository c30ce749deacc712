package com.phaseforge.core.persistence;

import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.RunState;
import com.phaseforge.core.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path root;

    private RunPaths paths;
    private JsonFileStateStore store;

    @BeforeEach
    void setUp() {
        paths = RunPaths.of(root);
        store = new JsonFileStateStore(paths);
    }

    @Test
    @DisplayName("saved state loads back equal")
    void saveAndLoad() {
        RunState state = RunState.started("PF-1", "plan", Map.of("k", "v"), T0);

        store.save(state);

        assertTrue(Files.isRegularFile(paths.runFile("PF-1")));
        assertEquals(state, store.load("PF-1").orElseThrow());
    }

    @Test
    @DisplayName("loading an unknown run is empty")
    void unknownRun() {
        assertTrue(store.load("PF-missing").isEmpty());
    }

    @Test
    @DisplayName("a later save replaces the snapshot and leaves no temp files")
    void saveReplaces() throws IOException {
        RunState state = RunState.started("PF-1", "plan", Map.of(), T0);
        store.save(state);
        store.save(state.withStatus(RunStatus.NEEDS_REVISION, T0.plusSeconds(5)));

        assertEquals(RunStatus.NEEDS_REVISION, store.load("PF-1").orElseThrow().status());
        try (var files = Files.list(paths.runsDir())) {
            assertEquals(List.of("PF-1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("lists run ids sorted and finds the latest by update time")
    void listAndLatest() {
        store.save(RunState.started("PF-b", "plan", Map.of(), T0.plusSeconds(10)));
        store.save(RunState.started("PF-a", "plan", Map.of(), T0.plusSeconds(20)));

        assertEquals(List.of("PF-a", "PF-b"), store.listRunIds());
        assertEquals("PF-a", store.latest().orElseThrow().runId());
    }

    @Test
    @DisplayName("a corrupt snapshot surfaces as StatePersistenceException")
    void corruptFile() throws IOException {
        Files.createDirectories(paths.runsDir());
        Files.writeString(paths.runFile("PF-bad"), "{ not json");

        assertThrows(StatePersistenceException.class, () -> store.load("PF-bad"));
    }
}
