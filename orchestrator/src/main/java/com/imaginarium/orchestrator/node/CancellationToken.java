package com.imaginarium.orchestrator.node;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to node executors.
 *
 * Executors that can abort mid-flight should poll {@link #isCancelled()}
 * at safe points. Executors that cannot are left alone; the worker simply
 * disregards their result when the run has been cancelled.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Throws a PERMANENT {@link NodeExecutionException} if cancellation was requested. */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw NodeExecutionException.permanentError("CANCELLED", "Execution cancelled");
        }
    }
}
