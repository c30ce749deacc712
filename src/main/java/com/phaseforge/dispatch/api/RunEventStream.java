package com.phaseforge.dispatch.api;

import com.phaseforge.core.events.EventBus;
import com.phaseforge.core.events.PipelineEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams a run's events to HTTP clients as server-sent events.
 * <p>
 * A new stream first replays the events the {@link EventBus} still holds for the run, then
 * follows it live. The stream is completed after {@code run.completed}; runs waiting for approval
 * or revision keep their streams open. Idle streams get a comment frame every
 * {@value #HEARTBEAT_INTERVAL_SECONDS}s so proxies do not drop them.
 */
@Service
public class RunEventStream {

    private static final Logger log = LoggerFactory.getLogger(RunEventStream.class);

    static final String RUN_COMPLETED = "run.completed";

    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 25;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<Stream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "run-events-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public RunEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    RunEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeat.shutdownNow();
        streams.forEach(stream -> stream.emitter.complete());
    }

    public SseEmitter open(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Stream stream = new Stream(runId, emitter);
        streams.add(stream);

        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> {
            log.debug("Event stream for run {} timed out", runId);
            close(stream);
        });
        emitter.onError(e -> {
            log.debug("Event stream for run {} failed: {}", runId, e.getMessage());
            close(stream);
        });

        EventBus.Subscription subscription = eventBus.subscribe(runId, true, event -> forward(stream, event));
        stream.subscription = subscription;
        if (stream.closed) {
            // the replay already held run.completed
            subscription.unsubscribe();
        }
        log.info("Opened event stream for run {}", runId);
        return emitter;
    }

    public int openStreams() {
        return streams.size();
    }

    private void forward(Stream stream, PipelineEvent event) {
        if (stream.closed) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("run_id", event.runId());
        if (event.phase() != null) {
            data.put("phase", event.phase());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
            if (RUN_COMPLETED.equals(event.eventType())) {
                stream.emitter.complete();
                close(stream);
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event stream for run {}: {}", stream.runId, e.getMessage());
            close(stream);
        }
    }

    private void sendHeartbeats() {
        for (Stream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                close(stream);
            }
        }
    }

    private void close(Stream stream) {
        stream.closed = true;
        EventBus.Subscription subscription = stream.subscription;
        if (subscription != null) {
            subscription.unsubscribe();
        }
        streams.remove(stream);
    }

    private static final class Stream {
        final String runId;
        final SseEmitter emitter;
        volatile EventBus.Subscription subscription;
        volatile boolean closed;

        Stream(String runId, SseEmitter emitter) {
            this.runId = runId;
            this.emitter = emitter;
        }
    }
}
