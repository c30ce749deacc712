package com.phaseforge.core.config;

import com.phaseforge.core.model.WorkerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowConfigLoaderTest {

    private final WorkflowConfigLoader loader = new WorkflowConfigLoader();
    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setProjectRoot(System.getProperty("java.io.tmpdir"));
    }

    private static PipelineProperties.Worker local(String command) {
        var worker = new PipelineProperties.Worker();
        worker.setCommand(command);
        return worker;
    }

    private static PipelineProperties.Phase phase(String name, String... workers) {
        var phase = new PipelineProperties.Phase();
        phase.setName(name);
        phase.setWorkers(List.of(workers));
        return phase;
    }

    @Test
    @DisplayName("resolves worker kinds and timeouts once")
    void resolvesWorkers() {
        properties.getWorkers().put("planner", local("echo plan"));
        var reviewer = new PipelineProperties.Worker();
        reviewer.setType("remote");
        reviewer.setEndpoint("http://localhost:9000/review");
        reviewer.setRequest("Review it");
        reviewer.setTimeoutSeconds(30);
        properties.getWorkers().put("reviewer", reviewer);
        properties.getPhases().add(phase("plan", "planner"));
        properties.getPhases().add(phase("review", "reviewer"));

        WorkflowDefinition workflow = loader.load(properties);

        assertInstanceOf(WorkerSpec.Local.class, workflow.worker("planner"));
        assertEquals(Duration.ofSeconds(600), workflow.worker("planner").timeout());
        assertInstanceOf(WorkerSpec.Remote.class, workflow.worker("reviewer"));
        assertEquals(Duration.ofSeconds(30), workflow.worker("reviewer").timeout());
        assertEquals("plan", workflow.firstEnabledPhase());
        assertEquals("review", workflow.nextEnabledPhase("plan"));
        assertNull(workflow.nextEnabledPhase("review"));
        assertTrue(workflow.projectRoot().isAbsolute());
    }

    @Test
    @DisplayName("disabled phases are skipped by the ordering")
    void skipsDisabledPhases() {
        properties.getWorkers().put("w", local("true"));
        var skipped = phase("lint", "w");
        skipped.setEnabled(false);
        properties.getPhases().add(phase("plan", "w"));
        properties.getPhases().add(skipped);
        properties.getPhases().add(phase("build", "w"));

        WorkflowDefinition workflow = loader.load(properties);

        assertEquals("build", workflow.nextEnabledPhase("plan"));
        assertEquals(2, workflow.enabledPhases().size());
    }

    @Test
    @DisplayName("reports every problem at once")
    void collectsProblems() {
        var unknownType = new PipelineProperties.Worker();
        unknownType.setType("carrier-pigeon");
        properties.getWorkers().put("odd", unknownType);
        properties.getWorkers().put("empty", local(" "));
        properties.getPhases().add(phase("plan", "ghost"));
        properties.getPhases().add(phase("plan"));
        properties.getRetry().setJitter(2.0);

        var error = assertThrows(WorkflowConfigurationException.class, () -> loader.load(properties));

        List<String> problems = error.getProblems();
        assertTrue(problems.contains("worker 'odd' has unknown type 'carrier-pigeon'"));
        assertTrue(problems.contains("local worker 'empty' has no command"));
        assertTrue(problems.contains("phase 'plan' references unknown worker 'ghost'"));
        assertTrue(problems.contains("duplicate phase 'plan'"));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("retry: ")));
    }

    @Test
    @DisplayName("a remote worker needs an endpoint with a scheme and a request")
    void remoteValidation() {
        var remote = new PipelineProperties.Worker();
        remote.setType("remote");
        remote.setEndpoint("/review");
        properties.getWorkers().put("reviewer", remote);

        var error = assertThrows(WorkflowConfigurationException.class, () -> loader.load(properties));

        assertEquals(1, error.getProblems().size());
    }

    @Test
    @DisplayName("unknown phase names are rejected")
    void unknownPhase() {
        properties.getWorkers().put("w", local("true"));
        properties.getPhases().add(phase("plan", "w"));

        WorkflowDefinition workflow = loader.load(properties);

        assertThrows(WorkflowConfigurationException.class, () -> workflow.phase("deploy"));
    }
}
