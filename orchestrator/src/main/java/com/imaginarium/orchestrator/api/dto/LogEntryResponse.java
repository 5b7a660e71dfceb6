package com.imaginarium.orchestrator.api.dto;

import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.LogLevel;

import java.time.Instant;
import java.util.UUID;

/** One line of GET /runs/{id}/logs; page with afterSequence = last sequence seen. */
public record LogEntryResponse(
        long     sequence,
        UUID     taskId,
        int      attempt,
        LogLevel level,
        String   message,
        String   errorCode,
        Instant  createdAt
) {
    public static LogEntryResponse from(ExecutionLogEntry e) {
        return new LogEntryResponse(
                e.getSequence(),
                e.getTaskId(),
                e.getAttempt(),
                e.getLevel(),
                e.getMessage(),
                e.getErrorCode(),
                e.getCreatedAt()
        );
    }
}
