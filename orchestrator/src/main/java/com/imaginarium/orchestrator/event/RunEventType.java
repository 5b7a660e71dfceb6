package com.imaginarium.orchestrator.event;

import com.imaginarium.orchestrator.model.LogLevel;

public enum RunEventType {
    RUN_QUEUED(LogLevel.INFO),
    RUN_STARTED(LogLevel.INFO),
    TASK_STARTED(LogLevel.INFO),
    TASK_COMPLETED(LogLevel.INFO),
    TASK_RETRYING(LogLevel.WARN),
    TASK_FAILED(LogLevel.ERROR),
    TASK_SKIPPED(LogLevel.INFO),
    RUN_COMPLETED(LogLevel.INFO),
    RUN_FAILED(LogLevel.ERROR),
    RUN_CANCELLED(LogLevel.WARN);

    private final LogLevel logLevel;

    RunEventType(LogLevel logLevel) {
        this.logLevel = logLevel;
    }

    /** Level of the execution log entry recorded alongside the event. */
    public LogLevel logLevel() { return logLevel; }

    public boolean isRunTerminal() {
        return this == RUN_COMPLETED || this == RUN_FAILED || this == RUN_CANCELLED;
    }
}
