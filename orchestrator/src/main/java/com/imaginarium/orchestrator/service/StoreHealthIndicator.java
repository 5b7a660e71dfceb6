package com.imaginarium.orchestrator.service;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reports whether the execution store was reachable on the last dispatch
 * cycle. Exposed as {@code store} under /actuator/health.
 */
@Component
public class StoreHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Execution store unavailable");

    private record State(boolean up, String reason, Instant since) {}

    private final AtomicReference<State> state;
    private final Clock clock;

    public StoreHealthIndicator(Clock clock) {
        this.clock = clock;
        this.state = new AtomicReference<>(new State(true, null, clock.instant()));
    }

    public void markUp() {
        if (!state.get().up()) {
            state.set(new State(true, null, clock.instant()));
        }
    }

    public void markDegraded(Throwable cause) {
        State current = state.get();
        String reason = cause.getMessage();
        state.set(new State(false, reason, current.up() ? clock.instant() : current.since()));
    }

    public boolean isUp() {
        return state.get().up();
    }

    @Override
    public Health health() {
        State s = state.get();
        if (s.up()) {
            return Health.up().withDetail("since", s.since().toString()).build();
        }
        return Health.status(DEGRADED)
                .withDetail("since", s.since().toString())
                .withDetail("reason", String.valueOf(s.reason()))
                .build();
    }
}
