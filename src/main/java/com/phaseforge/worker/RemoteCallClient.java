package com.phaseforge.worker;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Transport for remote workers.
 */
public interface RemoteCallClient {

    /**
     * The payload sent to a remote worker.
     *
     * @param priorArtifacts artifacts of earlier phases, keyed by phase name
     */
    record RemoteCall(
            URI endpoint,
            Map<String, String> headers,
            String runId,
            String phase,
            String workerId,
            String request,
            Map<String, List<String>> priorArtifacts
    ) {}

    /**
     * @param statusCode HTTP-style status; 2xx is success
     * @param body       the response exactly as received
     * @param output     the worker's text answer extracted from {@code body}
     */
    record RemoteResponse(int statusCode, String body, String output) {

        /** A response whose body is the answer itself. */
        public RemoteResponse(int statusCode, String body) {
            this(statusCode, body, body);
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    RemoteResponse call(RemoteCall call) throws IOException, InterruptedException;

    /**
     * The exact payload {@link #call} sends for {@code call}.
     */
    default String envelope(RemoteCall call) {
        return call.request();
    }
}
