package com.phaseforge.core.config;

import com.phaseforge.core.checkpoint.CheckpointValidator;
import com.phaseforge.core.persistence.JsonFileStateStore;
import com.phaseforge.core.persistence.StateStore;
import com.phaseforge.core.reliability.BackoffCalculator;
import com.phaseforge.core.reliability.RetryExecutor;
import com.phaseforge.core.reliability.Sleeper;
import com.phaseforge.core.reliability.TimeoutGuard;
import com.phaseforge.core.reliability.TransientErrorClassifier;
import com.phaseforge.worker.HttpRemoteCallClient;
import com.phaseforge.worker.PassThroughRequestRenderer;
import com.phaseforge.worker.RemoteCallClient;
import com.phaseforge.worker.WorkerRequestRenderer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the workflow engine from {@link PipelineProperties}.
 * <p>
 * The workflow is loaded and validated once at startup; a broken configuration fails the context
 * with every problem listed.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkflowDefinition workflowDefinition(WorkflowConfigLoader loader, PipelineProperties properties) {
        return loader.load(properties);
    }

    @Bean
    public RunPaths runPaths(WorkflowDefinition workflow, PipelineProperties properties) {
        return new RunPaths(workflow.projectRoot(), properties.getStateDir());
    }

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore stateStore(RunPaths paths) {
        log.info("Run state kept under {}", paths.stateDir());
        return new JsonFileStateStore(paths);
    }

    @Bean
    public CheckpointValidator checkpointValidator(RunPaths paths) {
        return new CheckpointValidator(paths.stateDir());
    }

    @Bean(destroyMethod = "close")
    public TimeoutGuard timeoutGuard() {
        return new TimeoutGuard();
    }

    @Bean
    public BackoffCalculator backoffCalculator(PipelineProperties properties) {
        Long seed = properties.getRetry().getSeed();
        if (seed != null) {
            log.info("Retry jitter seeded with {}", seed);
            return new BackoffCalculator(new Random(seed));
        }
        return new BackoffCalculator(new Random());
    }

    @Bean
    public RetryExecutor retryExecutor(BackoffCalculator backoffCalculator) {
        return new RetryExecutor(backoffCalculator, Sleeper.SYSTEM);
    }

    @Bean
    public TransientErrorClassifier transientErrorClassifier() {
        return new TransientErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean(WorkerRequestRenderer.class)
    public WorkerRequestRenderer workerRequestRenderer() {
        return new PassThroughRequestRenderer();
    }

    @Bean
    @ConditionalOnMissingBean(RemoteCallClient.class)
    public RemoteCallClient remoteCallClient() {
        return new HttpRemoteCallClient();
    }

    /**
     * Fallback registry for CLI runs, where no monitoring backend is configured.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
