package com.phaseforge.core.persistence;

import com.phaseforge.core.model.RunState;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable home of run snapshots. Each {@link #save} replaces the whole snapshot of that run.
 */
public interface StateStore {

    /**
     * @throws StatePersistenceException when the snapshot could not be written in full
     */
    void save(RunState state);

    Optional<RunState> load(String runId);

    List<String> listRunIds();

    /** The most recently updated run, if any. */
    default Optional<RunState> latest() {
        return listRunIds().stream()
                .map(this::load)
                .flatMap(Optional::stream)
                .filter(s -> Objects.nonNull(s.updatedAt()))
                .max(Comparator.comparing(RunState::updatedAt).thenComparing(RunState::runId));
    }
}
