package com.phaseforge.core.config;

import com.phaseforge.core.model.PhaseSpec;
import com.phaseforge.core.model.WorkerSpec;
import com.phaseforge.core.reliability.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns bound {@link PipelineProperties} into a {@link WorkflowDefinition}.
 * <p>
 * Worker types are resolved here, once, so nothing downstream inspects type strings. All
 * problems are collected and reported together.
 */
@Component
public class WorkflowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigLoader.class);

    public WorkflowDefinition load(PipelineProperties properties) {
        List<String> problems = new ArrayList<>();
        Duration defaultTimeout = Duration.ofSeconds(properties.getDefaultTimeoutSeconds());

        Map<String, WorkerSpec> workers = new LinkedHashMap<>();
        properties.getWorkers().forEach((id, worker) -> {
            WorkerSpec spec = resolveWorker(id, worker, defaultTimeout, problems);
            if (spec != null) {
                workers.put(id, spec);
            }
        });

        List<PhaseSpec> phases = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PipelineProperties.Phase phase : properties.getPhases()) {
            String name = phase.getName();
            if (name == null || name.isBlank()) {
                problems.add("phase without a name");
                continue;
            }
            if (!names.add(name)) {
                problems.add("duplicate phase '" + name + "'");
                continue;
            }
            for (String workerId : phase.getWorkers()) {
                if (!properties.getWorkers().containsKey(workerId)) {
                    problems.add("phase '" + name + "' references unknown worker '" + workerId + "'");
                }
            }
            if (phase.getMaxConcurrency() < 1) {
                problems.add("phase '" + name + "' has max-concurrency " + phase.getMaxConcurrency());
            }
            phases.add(new PhaseSpec(name, phase.getWorkers(), phase.isParallel(), phase.getMaxConcurrency(),
                    phase.isRequiresApproval(), phase.getArtifactsRequired(), phase.isFailFast(),
                    phase.isEnabled()));
        }

        RetryPolicy retryPolicy = null;
        try {
            retryPolicy = toRetryPolicy(properties.getRetry());
        } catch (IllegalArgumentException e) {
            problems.add("retry: " + e.getMessage());
        }

        if (!problems.isEmpty()) {
            throw new WorkflowConfigurationException(problems);
        }

        Path root = Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
        log.info("Loaded workflow with {} phase(s) and {} worker(s), project root {}",
                phases.size(), workers.size(), root);
        return new WorkflowDefinition(root, phases, workers, retryPolicy);
    }

    static RetryPolicy toRetryPolicy(PipelineProperties.Retry retry) {
        return new RetryPolicy(
                retry.getMaxRetries(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getBackoffMultiplier(),
                retry.getJitter(),
                Set.copyOf(retry.getTransientExitCodes()),
                retry.getTransientMessages());
    }

    private static WorkerSpec resolveWorker(String id, PipelineProperties.Worker worker,
                                            Duration defaultTimeout, List<String> problems) {
        Duration timeout = worker.getTimeoutSeconds() != null
                ? Duration.ofSeconds(worker.getTimeoutSeconds())
                : defaultTimeout;
        String type = worker.getType() == null ? "local" : worker.getType().trim().toLowerCase();
        switch (type) {
            case "local":
                if (isBlank(worker.getCommand())) {
                    problems.add("local worker '" + id + "' has no command");
                    return null;
                }
                return new WorkerSpec.Local(id, worker.getCommand(), worker.getWorkingDirectory(),
                        worker.getEnv(), timeout);
            case "remote":
                if (isBlank(worker.getEndpoint())) {
                    problems.add("remote worker '" + id + "' has no endpoint");
                    return null;
                }
                try {
                    URI uri = URI.create(worker.getEndpoint());
                    if (uri.getScheme() == null) {
                        problems.add("remote worker '" + id + "' endpoint has no scheme: " + worker.getEndpoint());
                        return null;
                    }
                } catch (IllegalArgumentException e) {
                    problems.add("remote worker '" + id + "' has an invalid endpoint: " + e.getMessage());
                    return null;
                }
                if (isBlank(worker.getRequest()) && isBlank(worker.getRequestFile())) {
                    problems.add("remote worker '" + id + "' needs request or request-file");
                    return null;
                }
                return new WorkerSpec.Remote(id, worker.getEndpoint(), worker.getRequest(),
                        worker.getRequestFile(), worker.getHeaders(), timeout);
            default:
                problems.add("worker '" + id + "' has unknown type '" + worker.getType() + "'");
                return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
