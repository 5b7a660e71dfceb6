package com.imaginarium.orchestrator.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges events raised inside a store transaction to the sinks.
 *
 * Delivery happens after commit, so a rolled-back transition never reaches a
 * subscriber. Events raised outside a transaction (in-memory store) are
 * delivered immediately.
 */
@Component
public class RunEventRelay {

    private final RunEventPublisher publisher;

    public RunEventRelay(RunEventPublisher publisher) {
        this.publisher = publisher;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRunEvent(RunEvent event) {
        publisher.publish(event);
    }
}
