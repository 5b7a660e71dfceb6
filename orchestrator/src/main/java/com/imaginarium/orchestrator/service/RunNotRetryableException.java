package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.model.RunStatus;

import java.util.UUID;

/** Only FAILED or CANCELLED runs can be re-submitted. */
public class RunNotRetryableException extends RuntimeException {

    public RunNotRetryableException(UUID runId, RunStatus status) {
        super("Only FAILED or CANCELLED runs can be retried; run " + runId + " is " + status);
    }
}
