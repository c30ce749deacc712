package com.phaseforge.dispatch.api;

import com.phaseforge.core.engine.InvalidStateException;
import com.phaseforge.core.engine.RunBusyException;
import com.phaseforge.core.engine.RunEngine;
import com.phaseforge.core.engine.RunNotFoundException;
import com.phaseforge.core.model.PhaseOutcome;
import com.phaseforge.core.model.RunState;
import com.phaseforge.core.persistence.StatePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST API over the {@link RunEngine}, available in serve mode.
 * <p>
 * Each endpoint maps to one engine operation. Phase execution is synchronous: the
 * {@code advance} call returns once the phase outcome has been persisted.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunEngine engine;
    private final RunEventStream eventStream;

    public RunController(RunEngine engine, RunEventStream eventStream) {
        this.engine = engine;
        this.eventStream = eventStream;
    }

    @PostMapping
    public ResponseEntity<RunState> startRun(@RequestBody(required = false) StartRunRequest request) {
        Map<String, String> params = request != null && request.params() != null ? request.params() : Map.of();
        RunState state = engine.start(params);
        return ResponseEntity.status(HttpStatus.CREATED).body(state);
    }

    @GetMapping
    public ResponseEntity<List<RunState>> listRuns() {
        return ResponseEntity.ok(engine.listRuns());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RunState> getRun(@PathVariable String id) {
        return ResponseEntity.ok(engine.status(id));
    }

    @GetMapping(value = "/{id}/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getMetrics(@PathVariable String id) {
        return engine.metricsExposition(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/runs/{id}/events: server-sent events of the run, replaying recent ones first.
     */
    @GetMapping("/{id}/events")
    public SseEmitter streamEvents(@PathVariable String id) {
        engine.status(id);
        return eventStream.open(id);
    }

    @PostMapping("/{id}/advance")
    public ResponseEntity<PhaseOutcome> advance(@PathVariable String id) {
        return ResponseEntity.ok(engine.advance(id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<RunState> approve(@PathVariable String id) {
        return ResponseEntity.ok(engine.approve(id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<RunState> reject(@PathVariable String id,
                                           @RequestBody(required = false) RejectRequest request) {
        return ResponseEntity.ok(engine.reject(id, request != null ? request.reason() : null));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<RunState> resume(@PathVariable String id) {
        return ResponseEntity.ok(engine.resume(id));
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(RunNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", e.getMessage(),
                "status", e.getStatus().wireName()));
    }

    @ExceptionHandler(RunBusyException.class)
    public ResponseEntity<Map<String, String>> handleBusy(RunBusyException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(StatePersistenceException.class)
    public ResponseEntity<Map<String, String>> handlePersistence(StatePersistenceException e) {
        log.error("Persistence failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }
}
