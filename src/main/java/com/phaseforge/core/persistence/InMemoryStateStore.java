package com.phaseforge.core.persistence;

import com.phaseforge.core.model.RunState;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link StateStore}, for tests and embedded use. State is lost with the process.
 */
public class InMemoryStateStore implements StateStore {

    private final ConcurrentHashMap<String, RunState> runs = new ConcurrentHashMap<>();

    @Override
    public void save(RunState state) {
        runs.put(state.runId(), state);
    }

    @Override
    public Optional<RunState> load(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<String> listRunIds() {
        return runs.keySet().stream().sorted().toList();
    }
}
