package com.phaseforge.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * POSTs a JSON envelope to the worker endpoint.
 * <pre>
 * {"run_id": "...", "phase": "...", "worker": "...", "request": "...", "artifacts": {"plan": ["..."]}}
 * </pre>
 * A JSON response with a string {@code output} field yields that field as the worker's answer; any
 * other body is used as-is. The raw body is always returned alongside.
 */
public class HttpRemoteCallClient implements RemoteCallClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteCallClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRemoteCallClient() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public HttpRemoteCallClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public RemoteResponse call(RemoteCall call) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(call.endpoint())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/plain")
                .POST(HttpRequest.BodyPublishers.ofString(envelope(call)));
        call.headers().forEach(builder::header);

        log.debug("POST {} for worker {}", call.endpoint(), call.workerId());
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        String body = response.body() != null ? response.body() : "";
        return new RemoteResponse(response.statusCode(), body, extractOutput(body));
    }

    @Override
    public String envelope(RemoteCall call) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("run_id", call.runId());
        body.put("phase", call.phase());
        body.put("worker", call.workerId());
        body.put("request", call.request());
        ObjectNode artifacts = body.putObject("artifacts");
        call.priorArtifacts().forEach((phase, paths) -> {
            var array = artifacts.putArray(phase);
            paths.forEach(array::add);
        });
        return body.toString();
    }

    String extractOutput(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.strip();
        if (!trimmed.startsWith("{")) {
            return body;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            JsonNode output = node.get("output");
            if (output != null && output.isTextual()) {
                return output.asText();
            }
        } catch (IOException e) {
            log.debug("Response is not JSON, using raw body: {}", e.getMessage());
        }
        return body;
    }
}
