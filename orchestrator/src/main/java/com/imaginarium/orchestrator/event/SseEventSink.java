package com.imaginarium.orchestrator.event;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pushes run events to browsers over server-sent events.
 *
 * Sends happen on a dedicated thread so a slow client never holds up the
 * thread that committed the transition. Subscriptions end when the client
 * goes away or the run reaches a terminal state.
 */
@Component
public class SseEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(SseEventSink.class);

    // 0 = no timeout; the stream is closed when the run finishes.
    private static final long EMITTER_TIMEOUT_MS = 0L;

    private final Map<UUID, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();

    private final ExecutorService sender = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "sse-sender");
        t.setDaemon(true);
        return t;
    });

    public SseEmitter subscribe(UUID runId) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        List<SseEmitter> list = subscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>());
        list.add(emitter);

        Runnable remove = () -> unsubscribe(runId, emitter);
        emitter.onCompletion(remove);
        emitter.onTimeout(remove);
        emitter.onError(e -> remove.run());
        log.debug("SSE subscriber added for run {} ({} total)", runId, list.size());
        return emitter;
    }

    @Override
    public void publish(UUID runId, RunEvent event) {
        List<SseEmitter> emitters = subscribers.get(runId);
        if (emitters == null || emitters.isEmpty()) {
            return;
        }
        sender.execute(() -> deliver(runId, emitters, event));
    }

    int subscriberCount(UUID runId) {
        List<SseEmitter> emitters = subscribers.get(runId);
        return emitters == null ? 0 : emitters.size();
    }

    private void deliver(UUID runId, List<SseEmitter> emitters, RunEvent event) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.sequence()))
                        .name(event.type().name())
                        .data(event));
                if (event.type().isRunTerminal()) {
                    emitter.complete();
                }
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE subscriber for run {}: {}", runId, e.getMessage());
                unsubscribe(runId, emitter);
            }
        }
        if (event.type().isRunTerminal()) {
            subscribers.remove(runId);
        }
    }

    private void unsubscribe(UUID runId, SseEmitter emitter) {
        subscribers.computeIfPresent(runId, (k, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }

    @PreDestroy
    void shutdown() {
        sender.shutdownNow();
    }
}
