package com.imaginarium.orchestrator.model;

/**
 * Lifecycle of a pipeline Run.
 *
 * Transitions:
 *   QUEUED  → RUNNING   (first task claimed)
 *   RUNNING → COMPLETED (every task resolved, no critical failure)
 *   RUNNING → FAILED    (every task resolved, at least one critical failure)
 *   QUEUED | RUNNING → CANCELLED (cancel request accepted)
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
