package com.imaginarium.orchestrator.store;

import java.time.Duration;
import java.util.UUID;

/**
 * Submission parameters for a new run.
 *
 * @param maxRetries  retry budget applied to every task of the run
 * @param timeout     how long the run may take from submission, or null for no limit
 * @param parentRunId the run this one re-submits, or null
 */
public record RunRequest(String pipelineId, String userId, int priority, int maxRetries,
                         Duration timeout, UUID parentRunId) {}
