package com.phaseforge.core.config;

import com.phaseforge.core.reliability.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw workflow configuration bound from {@code phaseforge.*}.
 * <p>
 * Nothing here is validated; {@link WorkflowConfigLoader} turns it into a {@link WorkflowDefinition}.
 */
@Component
@ConfigurationProperties(prefix = "phaseforge")
public class PipelineProperties {

    private String projectRoot = ".";
    private String stateDir = ".phaseforge";
    private int defaultTimeoutSeconds = 600;
    private Retry retry = new Retry();
    private Map<String, Worker> workers = new LinkedHashMap<>();
    private List<Phase> phases = new ArrayList<>();

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Map<String, Worker> getWorkers() { return workers; }
    public void setWorkers(Map<String, Worker> workers) { this.workers = workers; }
    public List<Phase> getPhases() { return phases; }
    public void setPhases(List<Phase> phases) { this.phases = phases; }

    public static class Retry {
        private int maxRetries = 2;
        private long baseDelayMs = 700;
        private double backoffMultiplier = 2.0;
        private double jitter = 0.25;
        private List<Integer> transientExitCodes = new ArrayList<>(RetryPolicy.DEFAULT_TRANSIENT_EXIT_CODES);
        private List<String> transientMessages = new ArrayList<>(RetryPolicy.DEFAULT_TRANSIENT_MESSAGES);
        /** Fixes the jitter sequence when set. */
        private Long seed;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
        public List<Integer> getTransientExitCodes() { return transientExitCodes; }
        public void setTransientExitCodes(List<Integer> transientExitCodes) { this.transientExitCodes = transientExitCodes; }
        public List<String> getTransientMessages() { return transientMessages; }
        public void setTransientMessages(List<String> transientMessages) { this.transientMessages = transientMessages; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    public static class Worker {
        /** {@code local} or {@code remote}. */
        private String type = "local";
        private String command;
        private String workingDirectory;
        private Map<String, String> env = new LinkedHashMap<>();
        private String endpoint;
        private String request;
        private String requestFile;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Integer timeoutSeconds;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getRequest() { return request; }
        public void setRequest(String request) { this.request = request; }
        public String getRequestFile() { return requestFile; }
        public void setRequestFile(String requestFile) { this.requestFile = requestFile; }
        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
        public Integer getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(Integer timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Phase {
        private String name;
        private List<String> workers = new ArrayList<>();
        private boolean parallel = false;
        private int maxConcurrency = 4;
        private boolean requiresApproval = false;
        private List<String> artifactsRequired = new ArrayList<>();
        private boolean failFast = false;
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getWorkers() { return workers; }
        public void setWorkers(List<String> workers) { this.workers = workers; }
        public boolean isParallel() { return parallel; }
        public void setParallel(boolean parallel) { this.parallel = parallel; }
        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public boolean isRequiresApproval() { return requiresApproval; }
        public void setRequiresApproval(boolean requiresApproval) { this.requiresApproval = requiresApproval; }
        public List<String> getArtifactsRequired() { return artifactsRequired; }
        public void setArtifactsRequired(List<String> artifactsRequired) { this.artifactsRequired = artifactsRequired; }
        public boolean isFailFast() { return failFast; }
        public void setFailFast(boolean failFast) { this.failFast = failFast; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
