package com.phaseforge.core.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phaseforge.core.config.RunPaths;
import com.phaseforge.core.model.RunMetrics;
import com.phaseforge.core.persistence.AtomicFiles;
import com.phaseforge.core.persistence.PipelineJson;
import com.phaseforge.core.persistence.StatePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes a run's metrics as {@code run_<id>.json} and {@code run_<id>.prom}, both rendered from the
 * same snapshot, and reads the JSON record back.
 */
@Component
public class MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(MetricsStore.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;

    public MetricsStore(RunPaths paths) {
        this.paths = paths;
        this.objectMapper = PipelineJson.createMapper();
    }

    public void save(RunMetrics metrics) {
        Path json = paths.metricsJson(metrics.runId());
        Path prom = paths.metricsProm(metrics.runId());
        try {
            AtomicFiles.writeString(json, objectMapper.writeValueAsString(metrics));
            AtomicFiles.writeString(prom, PrometheusExposition.format(metrics));
            log.debug("Saved metrics for run {} ({} phase(s))", metrics.runId(), metrics.phases().size());
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to save metrics for run " + metrics.runId(), e);
        }
    }

    public Optional<RunMetrics> load(String runId) {
        Path json = paths.metricsJson(runId);
        if (!Files.isRegularFile(json)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.toFile(), RunMetrics.class));
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read metrics for run " + runId, e);
        }
    }

    public Optional<String> loadExposition(String runId) {
        Path prom = paths.metricsProm(runId);
        if (!Files.isRegularFile(prom)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(prom));
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read metrics for run " + runId, e);
        }
    }
}
