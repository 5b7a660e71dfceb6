package com.imaginarium.orchestrator.node;

import java.util.UUID;

/**
 * Runtime context passed to every node execution.
 *
 * Executors use it to tag their own logs and to observe cancellation.
 */
public record NodeExecutionContext(UUID runId, UUID taskId, String nodeId, int attempt,
                                   CancellationToken cancellation) {}
