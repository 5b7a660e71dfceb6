package com.imaginarium.orchestrator.store;

/**
 * The run lock could not be acquired, or another writer changed the row
 * first. Safe to retry; see {@link StoreRetryTemplate}.
 */
public class ClaimConflictException extends RuntimeException {

    public ClaimConflictException(String message) {
        super(message);
    }

    public ClaimConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
