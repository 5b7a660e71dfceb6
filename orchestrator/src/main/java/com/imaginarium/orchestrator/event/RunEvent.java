package com.imaginarium.orchestrator.event;

import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A state change of a run or one of its tasks.
 *
 * {@code sequence} is strictly increasing per run, so a subscriber that
 * reconnects can tell exactly which events it missed. Task fields are null
 * for run-level events.
 */
public record RunEvent(
        UUID         runId,
        long         sequence,
        RunEventType type,
        UUID         taskId,
        String       nodeId,
        int          attempt,
        RunStatus    runStatus,
        TaskStatus   taskStatus,
        double       progress,
        String       message,
        String       errorCode,
        Instant      occurredAt) {

    public ExecutionLogEntry toLogEntry() {
        return new ExecutionLogEntry(runId, taskId, attempt, type.logLevel(),
                type + ": " + message, errorCode, occurredAt);
    }
}
