package com.imaginarium.orchestrator.api.dto;

import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of a task returned by GET /runs/{id}/tasks.
 */
public record TaskResponse(
        UUID                id,
        String              nodeId,
        String              nodeType,
        int                 executionOrder,
        TaskStatus          status,
        int                 attempt,
        int                 maxRetries,
        List<String>        dependsOn,
        Map<String, Object> output,
        String              errorCode,
        String              error,
        BigDecimal          cost,
        long                tokensUsed,
        String              workerId,
        Instant             startedAt,
        Instant             finishedAt,
        Instant             nextAttemptAt,
        Instant             heartbeatAt
) {
    public static TaskResponse from(TaskExecution t) {
        return new TaskResponse(
                t.getId(),
                t.getNodeId(),
                t.getNodeType(),
                t.getExecutionOrder(),
                t.getStatus(),
                t.getAttempt(),
                t.getMaxRetries(),
                t.getDependsOn(),
                t.getOutput(),
                t.getErrorCode(),
                t.getError(),
                t.getCost(),
                t.getTokensUsed(),
                t.getWorkerId(),
                t.getStartedAt(),
                t.getFinishedAt(),
                t.getNextAttemptAt(),
                t.getHeartbeatAt()
        );
    }
}
