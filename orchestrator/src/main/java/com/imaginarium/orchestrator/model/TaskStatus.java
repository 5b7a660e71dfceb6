package com.imaginarium.orchestrator.model;

/**
 * Execution state of a single TaskExecution.
 *
 * Transitions:
 *   PENDING  → READY     (every dependency SUCCEEDED)
 *   READY    → RUNNING   (claimed by a worker, compare-and-swap in the store)
 *   RUNNING  → SUCCEEDED
 *   RUNNING  → RETRYING  (transient failure, waiting for backoff)
 *   RETRYING → READY     (backoff elapsed)
 *   RUNNING  → FAILED    (permanent failure or retries exhausted)
 *   PENDING | READY | RETRYING | RUNNING → SKIPPED (failed ancestor or cancelled run)
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    RETRYING,
    SKIPPED;

    /** SUCCEEDED, FAILED and SKIPPED count towards run progress. */
    public boolean isResolved() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
