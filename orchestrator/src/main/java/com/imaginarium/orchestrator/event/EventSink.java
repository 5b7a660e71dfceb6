package com.imaginarium.orchestrator.event;

import java.util.UUID;

/**
 * Receives run events after the state change that produced them is durable.
 *
 * Implementations must return quickly: they are invoked on the thread that
 * committed the change.
 */
public interface EventSink {

    void publish(UUID runId, RunEvent event);
}
