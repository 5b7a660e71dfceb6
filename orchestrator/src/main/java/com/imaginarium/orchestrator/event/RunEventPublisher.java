package com.imaginarium.orchestrator.event;

import com.imaginarium.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans committed run events out to every registered {@link EventSink}.
 *
 * Transitions of one run commit in sequence order, but their after-commit
 * callbacks race each other. Events are therefore released per run strictly
 * by sequence: an event that arrives ahead of its predecessor is held until
 * the gap closes. A gap that stays open for {@code event-gap-timeout} (a
 * predecessor committed before this process started, for instance) is
 * skipped and the held events go out in order.
 */
@Component
public class RunEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RunEventPublisher.class);

    // A run idle this long loses its release position.
    private static final Duration RETENTION = Duration.ofMinutes(10);

    private final List<EventSink>        sinks;
    private final Clock                  clock;
    private final Duration               gapTimeout;
    private final Map<UUID, RunSequence> sequences = new ConcurrentHashMap<>();

    public RunEventPublisher(List<EventSink> sinks, Clock clock, OrchestratorProperties props) {
        this.sinks      = List.copyOf(sinks);
        this.clock      = clock;
        this.gapTimeout = props.getEventGapTimeout();
    }

    /** Release position of one run. Guarded by its own monitor. */
    private static final class RunSequence {
        long                      next = 1;
        final TreeMap<Long, RunEvent> held = new TreeMap<>();
        Instant                   gapSince;
        Instant                   lastActivity;
        boolean                   evicted;
    }

    public void publish(RunEvent event) {
        while (true) {
            RunSequence seq = sequences.computeIfAbsent(event.runId(), id -> new RunSequence());
            synchronized (seq) {
                if (seq.evicted) {
                    continue;
                }
                Instant now = clock.instant();
                seq.lastActivity = now;
                if (event.sequence() < seq.next) {
                    // Behind the release position: its gap was already given up on.
                    log.debug("Late event {} #{} for run {} (next is #{})",
                            event.type(), event.sequence(), event.runId(), seq.next);
                    deliver(event);
                } else {
                    seq.held.put(event.sequence(), event);
                }
                release(event.runId(), seq, now);
                return;
            }
        }
    }

    /** Gives up on gaps older than the gap timeout and forgets runs idle past retention. */
    @Scheduled(fixedDelay = 1000)
    public void releaseHeldEvents() {
        Instant now = clock.instant();
        for (Map.Entry<UUID, RunSequence> entry : sequences.entrySet()) {
            RunSequence seq = entry.getValue();
            synchronized (seq) {
                release(entry.getKey(), seq, now);
                if (seq.held.isEmpty() && seq.lastActivity != null
                        && Duration.between(seq.lastActivity, now).compareTo(RETENTION) > 0) {
                    seq.evicted = true;
                    sequences.remove(entry.getKey(), seq);
                }
            }
        }
    }

    int heldCount(UUID runId) {
        RunSequence seq = sequences.get(runId);
        if (seq == null) {
            return 0;
        }
        synchronized (seq) {
            return seq.held.size();
        }
    }

    // Caller holds the monitor of seq.
    private void release(UUID runId, RunSequence seq, Instant now) {
        boolean progressed = false;
        while (!seq.held.isEmpty() && seq.held.firstKey() == seq.next) {
            deliver(seq.held.pollFirstEntry().getValue());
            seq.next++;
            progressed = true;
        }
        if (seq.held.isEmpty()) {
            seq.gapSince = null;
            return;
        }
        if (seq.gapSince == null || progressed) {
            seq.gapSince = now;
            return;
        }
        if (Duration.between(seq.gapSince, now).compareTo(gapTimeout) >= 0) {
            long first = seq.held.firstKey();
            log.warn("Run {}: events #{}..#{} never arrived, releasing {} held event(s)",
                    runId, seq.next, first - 1, seq.held.size());
            while (!seq.held.isEmpty()) {
                RunEvent held = seq.held.pollFirstEntry().getValue();
                deliver(held);
                seq.next = held.sequence() + 1;
            }
            seq.gapSince = null;
        }
    }

    private void deliver(RunEvent event) {
        for (EventSink sink : sinks) {
            try {
                sink.publish(event.runId(), event);
            } catch (RuntimeException e) {
                // A failing sink must not affect the run or the other sinks.
                log.warn("Event sink {} rejected {} #{} for run {}: {}",
                        sink.getClass().getSimpleName(), event.type(), event.sequence(),
                        event.runId(), e.getMessage());
            }
        }
    }
}
