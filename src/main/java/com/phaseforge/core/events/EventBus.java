package com.phaseforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of run lifecycle events to in-process listeners.
 * <p>
 * The bus keeps the most recent events of each run so a listener that attaches mid-run (an SSE
 * client reconnecting, say) can replay what it missed before receiving live events. Events of one
 * run reach its listeners in publication order. Histories are kept for a bounded number of runs;
 * the least recently used run without listeners is forgotten first.
 * <p>
 * A listener that throws is logged and skipped. Listeners run on the publishing thread, which
 * is usually a worker thread, so they must not block.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_HISTORY_SIZE = 200;
    static final int DEFAULT_RETAINED_RUNS = 64;

    private final int historySize;
    private final int retainedRuns;
    // access order, least recently used first
    private final Map<String, RunChannel> channels = new LinkedHashMap<>(16, 0.75f, true);
    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> everyRun = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(DEFAULT_HISTORY_SIZE, DEFAULT_RETAINED_RUNS);
    }

    EventBus(int historySize, int retainedRuns) {
        if (historySize < 1 || retainedRuns < 1) {
            throw new IllegalArgumentException("historySize and retainedRuns must be positive");
        }
        this.historySize = historySize;
        this.retainedRuns = retainedRuns;
    }

    public void publish(PipelineEvent event) {
        log.debug("{} on run {}", event.eventType(), event.runId());
        channel(event.runId()).publish(event);
        for (Consumer<PipelineEvent> listener : everyRun) {
            deliver(listener, event);
        }
    }

    /**
     * Listens to one run.
     *
     * @param replay deliver the retained history first; no event is missed or repeated between
     *               the replay and the live stream
     */
    public Subscription subscribe(String runId, boolean replay, Consumer<PipelineEvent> listener) {
        RunChannel channel = channel(runId);
        channel.attach(listener, replay);
        return () -> channel.detach(listener);
    }

    public Subscription subscribe(String runId, Consumer<PipelineEvent> listener) {
        return subscribe(runId, false, listener);
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> listener) {
        everyRun.add(listener);
        return () -> everyRun.remove(listener);
    }

    /** Retained events of a run, oldest first. */
    public List<PipelineEvent> history(String runId) {
        RunChannel channel;
        synchronized (channels) {
            channel = channels.get(runId);
        }
        return channel != null ? channel.snapshot() : List.of();
    }

    int retainedRuns() {
        synchronized (channels) {
            return channels.size();
        }
    }

    private RunChannel channel(String runId) {
        synchronized (channels) {
            RunChannel channel = channels.get(runId);
            if (channel == null) {
                channel = new RunChannel();
                channels.put(runId, channel);
                evictIdle(runId);
            }
            return channel;
        }
    }

    private void evictIdle(String keep) {
        Iterator<Map.Entry<String, RunChannel>> it = channels.entrySet().iterator();
        while (channels.size() > retainedRuns && it.hasNext()) {
            Map.Entry<String, RunChannel> entry = it.next();
            if (entry.getValue().idle() && !entry.getKey().equals(keep)) {
                it.remove();
            }
        }
    }

    private static void deliver(Consumer<PipelineEvent> listener, PipelineEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }

    /** Stops delivery to one listener. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private final class RunChannel {

        private final ArrayDeque<PipelineEvent> history = new ArrayDeque<>();
        // read without the channel lock during eviction
        private final CopyOnWriteArrayList<Consumer<PipelineEvent>> listeners = new CopyOnWriteArrayList<>();

        synchronized void publish(PipelineEvent event) {
            if (history.size() == historySize) {
                history.removeFirst();
            }
            history.addLast(event);
            for (Consumer<PipelineEvent> listener : listeners) {
                deliver(listener, event);
            }
        }

        synchronized void attach(Consumer<PipelineEvent> listener, boolean replay) {
            if (replay) {
                for (PipelineEvent event : history) {
                    deliver(listener, event);
                }
            }
            listeners.add(listener);
        }

        void detach(Consumer<PipelineEvent> listener) {
            listeners.remove(listener);
        }

        boolean idle() {
            return listeners.isEmpty();
        }

        synchronized List<PipelineEvent> snapshot() {
            return List.copyOf(history);
        }
    }
}
