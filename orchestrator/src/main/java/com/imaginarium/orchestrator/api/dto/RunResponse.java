package com.imaginarium.orchestrator.api.dto;

import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for the /runs endpoints.
 * taskCounts is only filled in by GET /runs/{id}; pipelineOutputs only once
 * the run has COMPLETED.
 */
public record RunResponse(
        UUID                  id,
        String                pipelineId,
        String                userId,
        RunStatus             status,
        int                   priority,
        double                progress,
        int                   completedTasks,
        int                   totalTasks,
        int                   retryCount,
        BigDecimal            totalCost,
        long                  tokensUsed,
        Long                  durationMs,
        Instant               queuedAt,
        Instant               startedAt,
        Instant               completedAt,
        boolean               cancelRequested,
        String                cancelReason,
        String                lastError,
        UUID                  parentRunId,
        Instant               timeoutAt,
        Map<String, Object>   pipelineOutputs,
        Map<TaskStatus, Long> taskCounts
) {
    public static RunResponse from(Run run) {
        return from(run, null);
    }

    public static RunResponse from(Run run, Map<TaskStatus, Long> taskCounts) {
        return new RunResponse(
                run.getId(),
                run.getPipelineId(),
                run.getUserId(),
                run.getStatus(),
                run.getPriority(),
                run.getProgress(),
                run.getCompletedTasks(),
                run.getTotalTasks(),
                run.getRetryCount(),
                run.getTotalCost(),
                run.getTokensUsed(),
                run.getDurationMs(),
                run.getQueuedAt(),
                run.getStartedAt(),
                run.getCompletedAt(),
                run.isCancelRequested(),
                run.getCancelReason(),
                run.getLastError(),
                run.getParentRunId(),
                run.getTimeoutAt(),
                run.getPipelineOutputs(),
                taskCounts
        );
    }
}
