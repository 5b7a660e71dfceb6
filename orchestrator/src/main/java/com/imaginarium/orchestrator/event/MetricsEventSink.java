package com.imaginarium.orchestrator.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Counts run events by type: {@code orchestrator.run.events{type}}. */
@Component
public class MetricsEventSink implements EventSink {

    private final MeterRegistry meterRegistry;

    public MetricsEventSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void publish(UUID runId, RunEvent event) {
        meterRegistry.counter("orchestrator.run.events", "type", event.type().name()).increment();
    }
}
