package com.imaginarium.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only log line for a run, or for one task attempt within it.
 *
 * The generated id doubles as the stream sequence: readers page with
 * "afterSequence" and never see an entry change after it was written.
 * No foreign key to pipeline_runs: entries outlive a purge of the run.
 *
 * DB table: execution_logs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_logs")
public class ExecutionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    // Null for run-level entries.
    @Column(name = "task_id", updatable = false)
    private UUID taskId;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private LogLevel level;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "error_code", updatable = false)
    private String errorCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ExecutionLogEntry() {}   // required by JPA

    public ExecutionLogEntry(UUID runId, UUID taskId, int attempt, LogLevel level,
                             String message, String errorCode, Instant createdAt) {
        this.runId     = runId;
        this.taskId    = taskId;
        this.attempt   = attempt;
        this.level     = level;
        this.message   = message;
        this.errorCode = errorCode;
        this.createdAt = createdAt;
    }

    public static ExecutionLogEntry runLevel(UUID runId, LogLevel level, String message, Instant at) {
        return new ExecutionLogEntry(runId, null, 0, level, message, null, at);
    }

    /**
     * Assigns the sequence for stores that do not generate identifiers.
     * Only valid once, before the entry is visible to readers.
     */
    public void assignSequence(long sequence) {
        if (this.id != null) {
            throw new IllegalStateException("Log entry already has sequence " + id);
        }
        this.id = sequence;
    }

    public Long     getSequence()  { return id; }
    public UUID     getRunId()     { return runId; }
    public UUID     getTaskId()    { return taskId; }
    public int      getAttempt()   { return attempt; }
    public LogLevel getLevel()     { return level; }
    public String   getMessage()   { return message; }
    public String   getErrorCode() { return errorCode; }
    public Instant  getCreatedAt() { return createdAt; }
}
