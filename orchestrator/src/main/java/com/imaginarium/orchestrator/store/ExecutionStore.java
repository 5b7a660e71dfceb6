package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.TaskExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of runs, tasks and execution logs; the single authority on
 * execution state.
 *
 * Every state change goes through the run's lock and the run supervisor, so
 * readers always see a consistent run. Events produced by a change are
 * appended to the run's log in the same unit of work and published once that
 * unit is durable.
 *
 * Implementations may throw {@link ClaimConflictException} and
 * {@link StoreUnavailableException}; callers go through
 * {@link StoreRetryTemplate}.
 */
public interface ExecutionStore {

    /** Persists a new QUEUED run and its tasks; root tasks start READY. */
    Run createRun(ExecutionPlan plan, RunRequest request);

    Optional<Run> loadRun(UUID runId);

    /** Tasks of a run in plan order. Empty for an unknown run. */
    List<TaskExecution> listTasks(UUID runId);

    Optional<TaskExecution> loadTask(UUID taskId);

    /**
     * Runs with work that can start now, best first:
     * priority desc, queuedAt asc, submission order asc.
     */
    List<Run> listEligibleRuns(int limit);

    /** READY tasks of a run in plan order, after promoting retries whose backoff elapsed. */
    List<TaskExecution> findReadyTasks(UUID runId, int limit);

    /**
     * Atomically moves a READY task to RUNNING and assigns it to the worker.
     *
     * @return empty when another worker won, the task is not READY, or the run
     *         no longer accepts work
     */
    Optional<ClaimedTask> claimTask(UUID taskId, String workerId);

    /** @return false when the task is no longer RUNNING under that attempt */
    boolean heartbeat(UUID taskId, int attempt);

    /**
     * Applies an attempt's outcome, recomputes progress and finalizes the run
     * when everything has resolved, all atomically.
     *
     * @return false when the transition was stale and nothing changed
     */
    boolean updateTaskStatus(UUID taskId, TaskTransition transition);

    /**
     * @return false when the run was already terminal
     * @throws RunNotFoundException unknown run
     */
    boolean cancelRun(UUID runId, String reason);

    ExecutionLogEntry appendLog(ExecutionLogEntry entry);

    /** Entries with sequence greater than {@code afterSequence}, oldest first. */
    List<ExecutionLogEntry> listLogs(UUID runId, long afterSequence, int limit);

    /** RUNNING tasks whose last heartbeat is older than {@code cutoff}. */
    List<TaskExecution> findStalledTasks(Instant cutoff);

    /** Non-terminal runs whose deadline is at or before {@code now}. */
    List<Run> findTimedOutRuns(Instant now);

    /**
     * Fails a run whose deadline has passed, skipping the tasks that have not started.
     *
     * @return false when the run is terminal or its deadline is still ahead
     * @throws RunNotFoundException unknown run
     */
    boolean timeOutRun(UUID runId);
}
