package com.imaginarium.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One end-to-end execution attempt of a pipeline.
 *
 * A Run owns the TaskExecutions compiled from its pipeline definition.
 * It is only mutated through RunSupervisor while the store holds the run
 * lock, and never again once its status is terminal.
 *
 * DB table: pipeline_runs  (created by Flyway V1, outputs and deadline added in V2)
 */
@Entity
@Table(name = "pipeline_runs")
public class Run {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "pipeline_id", nullable = false)
    private String pipelineId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.QUEUED;

    // Higher is dispatched first.
    @Column(nullable = false)
    private int priority;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt = Instant.now();

    // Submission order; breaks ties between runs with equal priority and queuedAt.
    @Column(name = "queue_sequence", nullable = false)
    private long queueSequence;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(nullable = false)
    private double progress;

    @Column(name = "total_tasks", nullable = false)
    private int totalTasks;

    @Column(name = "completed_tasks", nullable = false)
    private int completedTasks;

    // Sum of task retries scheduled within this run.
    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 6)
    private BigDecimal totalCost = BigDecimal.ZERO;

    @Column(name = "tokens_used", nullable = false)
    private long tokensUsed;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "cancel_reason")
    private String cancelReason;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // Sequence number of the last RunEvent issued for this run.
    @Column(name = "event_sequence", nullable = false)
    private long eventSequence;

    // Set when this run was re-submitted from a FAILED or CANCELLED run.
    @Column(name = "parent_run_id")
    private UUID parentRunId;

    // Run is failed by the recovery loop once this passes; null = no deadline.
    @Column(name = "timeout_at")
    private Instant timeoutAt;

    // Outputs of every succeeded task keyed by node id; filled in on COMPLETED.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "pipeline_outputs", columnDefinition = "TEXT")
    private Map<String, Object> pipelineOutputs;

    @Version
    private Long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(String pipelineId, String userId, int priority) {
        this.pipelineId = pipelineId;
        this.userId     = userId;
        this.priority   = priority;
    }

    /** Detached copy for stores that hand out snapshots instead of managed entities. */
    public Run copy() {
        Run c = new Run(pipelineId, userId, priority);
        c.id              = id;
        c.status          = status;
        c.queuedAt        = queuedAt;
        c.queueSequence   = queueSequence;
        c.startedAt       = startedAt;
        c.completedAt     = completedAt;
        c.progress        = progress;
        c.totalTasks      = totalTasks;
        c.completedTasks  = completedTasks;
        c.retryCount      = retryCount;
        c.totalCost       = totalCost;
        c.tokensUsed      = tokensUsed;
        c.durationMs      = durationMs;
        c.cancelRequested = cancelRequested;
        c.cancelReason    = cancelReason;
        c.lastError       = lastError;
        c.eventSequence   = eventSequence;
        c.parentRunId     = parentRunId;
        c.timeoutAt       = timeoutAt;
        c.pipelineOutputs = pipelineOutputs == null ? null : new LinkedHashMap<>(pipelineOutputs);
        c.version         = version;
        return c;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()              { return id; }
    public String     getPipelineId()      { return pipelineId; }
    public String     getUserId()          { return userId; }
    public RunStatus  getStatus()          { return status; }
    public int        getPriority()        { return priority; }
    public Instant    getQueuedAt()        { return queuedAt; }
    public long       getQueueSequence()   { return queueSequence; }
    public Instant    getStartedAt()       { return startedAt; }
    public Instant    getCompletedAt()     { return completedAt; }
    public double     getProgress()        { return progress; }
    public int        getTotalTasks()      { return totalTasks; }
    public int        getCompletedTasks()  { return completedTasks; }
    public int        getRetryCount()      { return retryCount; }
    public BigDecimal getTotalCost()       { return totalCost; }
    public long       getTokensUsed()      { return tokensUsed; }
    public Long       getDurationMs()      { return durationMs; }
    public boolean    isCancelRequested()  { return cancelRequested; }
    public String     getCancelReason()    { return cancelReason; }
    public String     getLastError()       { return lastError; }
    public long       getEventSequence()   { return eventSequence; }
    public UUID       getParentRunId()     { return parentRunId; }
    public Instant    getTimeoutAt()       { return timeoutAt; }
    public Map<String, Object> getPipelineOutputs() { return pipelineOutputs; }

    public void setStatus(RunStatus status)            { this.status = status; }
    public void setQueuedAt(Instant t)                 { this.queuedAt = t; }
    public void setQueueSequence(long seq)             { this.queueSequence = seq; }
    public void setStartedAt(Instant t)                { this.startedAt = t; }
    public void setCompletedAt(Instant t)              { this.completedAt = t; }
    public void setProgress(double progress)           { this.progress = progress; }
    public void setTotalTasks(int n)                   { this.totalTasks = n; }
    public void setCompletedTasks(int n)               { this.completedTasks = n; }
    public void setDurationMs(Long durationMs)         { this.durationMs = durationMs; }
    public void setLastError(String lastError)         { this.lastError = lastError; }
    public void setParentRunId(UUID parentRunId)       { this.parentRunId = parentRunId; }
    public void setTimeoutAt(Instant timeoutAt)        { this.timeoutAt = timeoutAt; }
    public void setPipelineOutputs(Map<String, Object> outputs) { this.pipelineOutputs = outputs; }

    public void incrementRetryCount()                  { this.retryCount++; }

    public void requestCancel(String reason) {
        this.cancelRequested = true;
        this.cancelReason    = reason;
    }

    public void addUsage(BigDecimal cost, long tokens) {
        if (cost != null) this.totalCost = this.totalCost.add(cost);
        this.tokensUsed += tokens;
    }

    /** Issues the next per-run event sequence number. */
    public long nextEventSequence() {
        return ++this.eventSequence;
    }
}
