package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.graph.CompileResult;
import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.graph.PipelineDefinition;
import com.imaginarium.orchestrator.graph.TaskGraphCompiler;
import com.imaginarium.orchestrator.graph.TaskSpec;
import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.retry.RetryPolicy;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.RunNotFoundException;
import com.imaginarium.orchestrator.store.RunRequest;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Run lifecycle operations behind the submission API.
 *
 * Store calls go through {@link StoreRetryTemplate}, so lock conflicts are
 * absorbed here and callers only ever see {@code StoreUnavailableException}.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final int MAX_LOG_PAGE = 1000;

    private final TaskGraphCompiler  compiler;
    private final ExecutionStore     store;
    private final StoreRetryTemplate retryTemplate;
    private final RetryPolicy        retryPolicy;

    public RunService(TaskGraphCompiler compiler,
                      ExecutionStore store,
                      StoreRetryTemplate retryTemplate,
                      RetryPolicy retryPolicy) {
        this.compiler      = compiler;
        this.store         = store;
        this.retryTemplate = retryTemplate;
        this.retryPolicy   = retryPolicy;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Compile and enqueue a pipeline.
     *
     * @param maxRetries per-task retry budget, or null for the configured default
     * @param timeout    deadline measured from submission, or null for none
     * @throws PipelineValidationException the definition does not compile; nothing is persisted
     */
    public Run submit(String pipelineId, String userId, int priority, Integer maxRetries,
                      Duration timeout, PipelineDefinition definition) {
        CompileResult result = compiler.compile(definition);
        if (!result.isOk()) {
            log.info("Rejected pipeline '{}' from user {}: {}", pipelineId, userId, result.error().message());
            throw new PipelineValidationException(result.error());
        }
        int retries = maxRetries != null ? Math.max(0, maxRetries) : retryPolicy.defaultMaxRetries();
        Duration deadline = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
        RunRequest request = new RunRequest(pipelineId, userId, priority, retries, deadline, null);
        return retryTemplate.execute("create run", () -> store.createRun(result.plan(), request));
    }

    /**
     * Re-submit a FAILED or CANCELLED run as a new run with the same tasks.
     * The original run is left untouched; the new one links to it via parentRunId
     * and gets the same timeout, measured from its own submission.
     *
     * @throws RunNotRetryableException the run is not FAILED or CANCELLED
     */
    public Run retry(UUID runId) {
        Run original = load(runId);
        if (original.getStatus() != RunStatus.FAILED && original.getStatus() != RunStatus.CANCELLED) {
            throw new RunNotRetryableException(runId, original.getStatus());
        }
        List<TaskExecution> tasks = getTasks(runId);
        ExecutionPlan plan = new ExecutionPlan(tasks.stream()
                .sorted(Comparator.comparingInt(TaskExecution::getExecutionOrder))
                .map(RunService::toSpec)
                .toList());
        int retries = tasks.isEmpty() ? retryPolicy.defaultMaxRetries() : tasks.get(0).getMaxRetries();
        Duration timeout = original.getTimeoutAt() == null
                ? null
                : Duration.between(original.getQueuedAt(), original.getTimeoutAt());
        RunRequest request = new RunRequest(original.getPipelineId(), original.getUserId(),
                original.getPriority(), retries, timeout, original.getId());

        Run created = retryTemplate.execute("re-submit run", () -> store.createRun(plan, request));
        log.info("Run {} re-submitted as run {}", runId, created.getId());
        return created;
    }

    /**
     * @return false when the run had already finished
     * @throws RunNotFoundException unknown run
     */
    public boolean cancel(UUID runId, String reason) {
        boolean cancelled = retryTemplate.execute("cancel run " + runId, () -> store.cancelRun(runId, reason));
        log.info("Cancel request for run {}: {}", runId, cancelled ? "accepted" : "already finished");
        return cancelled;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Run> findById(UUID runId) {
        return retryTemplate.execute("load run " + runId, () -> store.loadRun(runId));
    }

    /** @throws RunNotFoundException unknown run */
    public List<TaskExecution> getTasks(UUID runId) {
        load(runId);
        return retryTemplate.execute("list tasks of run " + runId, () -> store.listTasks(runId));
    }

    /** Number of tasks in each status; every status is present. */
    public Map<TaskStatus, Long> taskCounts(UUID runId) {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            counts.put(s, 0L);
        }
        for (TaskExecution t : getTasks(runId)) {
            counts.merge(t.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * A page of the run's log stream: entries after {@code afterSequence},
     * oldest first, at most {@code limit} (capped at 1000).
     *
     * @throws RunNotFoundException unknown run
     */
    public List<ExecutionLogEntry> getLogs(UUID runId, long afterSequence, int limit) {
        load(runId);
        int page = Math.max(1, Math.min(limit, MAX_LOG_PAGE));
        return retryTemplate.execute("list logs of run " + runId,
                () -> store.listLogs(runId, Math.max(0, afterSequence), page));
    }

    private Run load(UUID runId) {
        return findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private static TaskSpec toSpec(TaskExecution t) {
        return new TaskSpec(t.getNodeId(), t.getNodeId(), t.getNodeType(), t.getConfig(),
                t.getDependsOn(), t.getInputBindings(), t.getExecutionOrder(),
                t.isOptional(), t.isRetryable(), Duration.ofMillis(t.getTimeoutMs()));
    }
}
