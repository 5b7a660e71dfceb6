package com.imaginarium.orchestrator.store;

/** The execution store cannot be reached. Nothing was changed. */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
