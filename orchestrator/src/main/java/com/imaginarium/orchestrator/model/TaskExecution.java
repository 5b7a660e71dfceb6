package com.imaginarium.orchestrator.model;

import com.imaginarium.orchestrator.graph.InputBinding;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The execution of a single pipeline node within a Run.
 *
 * A worker claims a READY task by compare-and-swap to RUNNING, invokes the
 * node executor and reports the outcome back through the store.
 *
 * DB table: task_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_executions")
public class TaskExecution {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "node_id", nullable = false)
    private String nodeId;

    @Column(name = "node_type", nullable = false)
    private String nodeType;

    // Position in the compiled plan (topological order).
    @Column(name = "execution_order", nullable = false)
    private int executionOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    // Number of times this task has been claimed (starts at 0).
    @Column(nullable = false)
    private int attempt;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "config_json", columnDefinition = "TEXT")
    private Map<String, Object> config = new LinkedHashMap<>();

    // Node ids of the tasks this one depends on.
    @Convert(converter = StringListConverter.class)
    @Column(name = "depends_on", nullable = false, columnDefinition = "TEXT")
    private List<String> dependsOn = new ArrayList<>();

    @Convert(converter = InputBindingListConverter.class)
    @Column(name = "input_bindings", nullable = false, columnDefinition = "TEXT")
    private List<InputBinding> inputBindings = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "output_json", columnDefinition = "TEXT")
    private Map<String, Object> output;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "error_code")
    private String errorCode;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal cost = BigDecimal.ZERO;

    @Column(name = "tokens_used", nullable = false)
    private long tokensUsed;

    // Which worker is running this task. Null unless RUNNING.
    @Column(name = "worker_id")
    private String workerId;

    // Updated by the worker while the node call is in flight (stall detection).
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // When a RETRYING task becomes READY again.
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Failure of an optional (non-critical) task does not fail the run.
    @Column(nullable = false)
    private boolean optional;

    @Column(nullable = false)
    private boolean retryable = true;

    @Column(name = "timeout_ms", nullable = false)
    private long timeoutMs;

    @Version
    private Long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskExecution() {}   // required by JPA

    public TaskExecution(UUID runId, String nodeId, String nodeType, int executionOrder) {
        this.runId          = runId;
        this.nodeId         = nodeId;
        this.nodeType       = nodeType;
        this.executionOrder = executionOrder;
    }

    /** Detached copy for stores that hand out snapshots instead of managed entities. */
    public TaskExecution copy() {
        TaskExecution c = new TaskExecution(runId, nodeId, nodeType, executionOrder);
        c.id            = id;
        c.status        = status;
        c.attempt       = attempt;
        c.maxRetries    = maxRetries;
        c.config        = config == null ? null : new LinkedHashMap<>(config);
        c.dependsOn     = new ArrayList<>(dependsOn);
        c.inputBindings = new ArrayList<>(inputBindings);
        c.output        = output == null ? null : new LinkedHashMap<>(output);
        c.error         = error;
        c.errorCode     = errorCode;
        c.cost          = cost;
        c.tokensUsed    = tokensUsed;
        c.workerId      = workerId;
        c.heartbeatAt   = heartbeatAt;
        c.nextAttemptAt = nextAttemptAt;
        c.startedAt     = startedAt;
        c.finishedAt    = finishedAt;
        c.optional      = optional;
        c.retryable     = retryable;
        c.timeoutMs     = timeoutMs;
        c.version       = version;
        return c;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                getId()             { return id; }
    public UUID                getRunId()          { return runId; }
    public String              getNodeId()         { return nodeId; }
    public String              getNodeType()       { return nodeType; }
    public int                 getExecutionOrder() { return executionOrder; }
    public TaskStatus          getStatus()         { return status; }
    public int                 getAttempt()        { return attempt; }
    public int                 getMaxRetries()     { return maxRetries; }
    public Map<String, Object> getConfig()         { return config; }
    public List<String>        getDependsOn()      { return dependsOn; }
    public List<InputBinding>  getInputBindings()  { return inputBindings; }
    public Map<String, Object> getOutput()         { return output; }
    public String              getError()          { return error; }
    public String              getErrorCode()      { return errorCode; }
    public BigDecimal          getCost()           { return cost; }
    public long                getTokensUsed()     { return tokensUsed; }
    public String              getWorkerId()       { return workerId; }
    public Instant             getHeartbeatAt()    { return heartbeatAt; }
    public Instant             getNextAttemptAt()  { return nextAttemptAt; }
    public Instant             getStartedAt()      { return startedAt; }
    public Instant             getFinishedAt()     { return finishedAt; }
    public boolean             isOptional()        { return optional; }
    public boolean             isRetryable()       { return retryable; }
    public long                getTimeoutMs()      { return timeoutMs; }

    public void setStatus(TaskStatus status)                 { this.status = status; }
    public void setMaxRetries(int maxRetries)                 { this.maxRetries = maxRetries; }
    public void setConfig(Map<String, Object> config)         { this.config = config; }
    public void setDependsOn(List<String> dependsOn)          { this.dependsOn = dependsOn; }
    public void setInputBindings(List<InputBinding> b)        { this.inputBindings = b; }
    public void setOutput(Map<String, Object> output)         { this.output = output; }
    public void setWorkerId(String workerId)                  { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)                     { this.heartbeatAt = t; }
    public void setNextAttemptAt(Instant t)                   { this.nextAttemptAt = t; }
    public void setStartedAt(Instant t)                       { this.startedAt = t; }
    public void setFinishedAt(Instant t)                      { this.finishedAt = t; }
    public void setOptional(boolean optional)                 { this.optional = optional; }
    public void setRetryable(boolean retryable)               { this.retryable = retryable; }
    public void setTimeoutMs(long timeoutMs)                  { this.timeoutMs = timeoutMs; }
    public void incrementAttempt()                            { this.attempt++; }

    public void recordError(String errorCode, String error) {
        this.errorCode = errorCode;
        this.error     = error;
    }

    public void recordUsage(BigDecimal cost, long tokensUsed) {
        this.cost       = cost == null ? BigDecimal.ZERO : cost;
        this.tokensUsed = tokensUsed;
    }
}
