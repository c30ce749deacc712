package com.phaseforge.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * How a worker is invoked. Resolved once when the workflow configuration is loaded.
 */
public sealed interface WorkerSpec permits WorkerSpec.Local, WorkerSpec.Remote {

    String id();

    /** Per-attempt timeout; null or non-positive means unbounded. */
    Duration timeout();

    /**
     * A shell command executed as a local subprocess.
     *
     * @param workingDirectory relative to the project root; null runs in the root itself
     */
    record Local(String id, String command, String workingDirectory,
                 Map<String, String> environment, Duration timeout) implements WorkerSpec {

        public Local {
            environment = environment != null ? Map.copyOf(environment) : Map.of();
        }
    }

    /**
     * A call to a remote worker endpoint.
     *
     * @param request     inline request text, used when {@code requestFile} is null
     * @param requestFile request template file, relative to the project root
     */
    record Remote(String id, String endpoint, String request, String requestFile,
                  Map<String, String> headers, Duration timeout) implements WorkerSpec {

        public Remote {
            headers = headers != null ? Map.copyOf(headers) : Map.of();
        }
    }
}
