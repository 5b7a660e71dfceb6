package com.imaginarium.orchestrator.supervisor;

import com.imaginarium.orchestrator.event.RunEvent;
import com.imaginarium.orchestrator.event.RunEventType;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.store.TaskTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The run and task state machine.
 *
 * <pre>
 *   Task:  PENDING → READY → RUNNING → SUCCEEDED
 *                              │  ↑
 *                              ↓  │ (backoff elapsed)
 *                           RETRYING
 *          RUNNING → FAILED          (permanent, or retries exhausted)
 *          PENDING | READY | RETRYING → SKIPPED  (failed ancestor, cancel)
 *          RUNNING → SKIPPED         (result discarded after cancel)
 *
 *   Run:   QUEUED → RUNNING → COMPLETED | FAILED
 *          QUEUED | RUNNING → CANCELLED
 *          QUEUED | RUNNING → FAILED   (deadline passed)
 * </pre>
 *
 * Pure with respect to I/O: every method mutates the given aggregate in place
 * and returns the events it produced, in order. The caller must hold the run
 * lock and persist the aggregate and events together.
 */
public class RunSupervisor {

    private static final Logger log = LoggerFactory.getLogger(RunSupervisor.class);

    /** Error code of the RUN_FAILED event emitted when a run exceeds its deadline. */
    public static final String RUN_TIMEOUT = "RUN_TIMEOUT";

    private static final Set<TaskStatus> UNRESOLVED =
            EnumSet.of(TaskStatus.PENDING, TaskStatus.READY, TaskStatus.RUNNING, TaskStatus.RETRYING);

    private final Clock clock;

    public RunSupervisor(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Run lifecycle
    // ------------------------------------------------------------------

    /** A freshly created run: root tasks become READY. */
    public List<RunEvent> initialize(RunAggregate agg) {
        List<RunEvent> events = new ArrayList<>();
        Run run = agg.run();
        run.setTotalTasks(agg.tasks().size());
        for (TaskExecution t : agg.tasks()) {
            if (t.getStatus() == TaskStatus.PENDING && t.getDependsOn().isEmpty()) {
                t.setStatus(TaskStatus.READY);
            }
        }
        recomputeProgress(agg);
        events.add(runEvent(agg, RunEventType.RUN_QUEUED,
                "Run queued with " + agg.tasks().size() + " task(s), priority " + run.getPriority()));
        return events;
    }

    /** Whether new attempts may still start in this run. */
    public boolean acceptsClaims(Run run) {
        return !run.getStatus().isTerminal() && !run.isCancelRequested();
    }

    /**
     * Bookkeeping after a task was claimed (its status is already RUNNING).
     * The first claim of a run moves it to RUNNING.
     */
    public List<RunEvent> onTaskClaimed(RunAggregate agg, TaskExecution task, String workerId) {
        List<RunEvent> events = new ArrayList<>();
        Run run = agg.run();
        Instant now = clock.instant();

        task.setStatus(TaskStatus.RUNNING);
        task.incrementAttempt();
        task.setWorkerId(workerId);
        task.setStartedAt(now);
        task.setHeartbeatAt(now);
        task.setNextAttemptAt(null);
        task.setFinishedAt(null);

        if (run.getStatus() == RunStatus.QUEUED) {
            run.setStatus(RunStatus.RUNNING);
            run.setStartedAt(now);
            events.add(runEvent(agg, RunEventType.RUN_STARTED, "Run started"));
        }
        events.add(taskEvent(agg, task, RunEventType.TASK_STARTED,
                "Task '" + task.getNodeId() + "' started (attempt " + task.getAttempt()
                        + ", worker " + workerId + ")", null));
        return events;
    }

    /**
     * Applies the outcome of one task attempt.
     *
     * Returns no events when the transition is stale: the task is no longer
     * RUNNING, or it is running a different attempt.
     */
    public List<RunEvent> apply(RunAggregate agg, UUID taskId, TaskTransition transition) {
        TaskExecution task = agg.task(taskId).orElse(null);
        if (task == null) {
            log.warn("Ignoring {} for unknown task {} in run {}",
                    transition.kind(), taskId, agg.run().getId());
            return List.of();
        }
        if (task.getStatus() != TaskStatus.RUNNING || task.getAttempt() != transition.attempt()) {
            log.debug("Ignoring stale {} for task {} (status={}, attempt={}, reported attempt={})",
                    transition.kind(), taskId, task.getStatus(), task.getAttempt(), transition.attempt());
            return List.of();
        }

        Run run = agg.run();
        if (run.getStatus().isTerminal() || run.isCancelRequested()) {
            // Whatever the node produced, the run no longer wants it.
            return discard(agg, task);
        }

        List<RunEvent> events = new ArrayList<>();
        switch (transition.kind()) {
            case SUCCEEDED -> succeed(agg, task, transition, events);
            case RETRY     -> scheduleRetry(agg, task, transition, events);
            case FAILED    -> fail(agg, task, transition, events);
            case DISCARD   -> events.addAll(discard(agg, task));
        }
        recomputeProgress(agg);
        finalizeIfResolved(agg, events);
        return events;
    }

    /** RETRYING tasks whose backoff has elapsed become READY again. */
    public int promoteDueRetries(RunAggregate agg) {
        if (!acceptsClaims(agg.run())) {
            return 0;
        }
        Instant now = clock.instant();
        int promoted = 0;
        for (TaskExecution t : agg.tasks()) {
            if (t.getStatus() == TaskStatus.RETRYING
                    && (t.getNextAttemptAt() == null || !t.getNextAttemptAt().isAfter(now))) {
                t.setStatus(TaskStatus.READY);
                t.setNextAttemptAt(null);
                promoted++;
            }
        }
        return promoted;
    }

    /**
     * Cancels a non-terminal run. Tasks that have not started are skipped;
     * RUNNING tasks keep running and their results are discarded when they report.
     *
     * @return no events when the run was already terminal
     */
    public List<RunEvent> cancel(RunAggregate agg, String reason) {
        Run run = agg.run();
        if (run.getStatus().isTerminal()) {
            return List.of();
        }
        List<RunEvent> events = new ArrayList<>();
        Instant now = clock.instant();

        run.requestCancel(reason);
        for (TaskExecution t : agg.tasks()) {
            if (t.getStatus() == TaskStatus.PENDING
                    || t.getStatus() == TaskStatus.READY
                    || t.getStatus() == TaskStatus.RETRYING) {
                skip(t, now);
                events.add(taskEvent(agg, t, RunEventType.TASK_SKIPPED,
                        "Task '" + t.getNodeId() + "' skipped: run cancelled", null));
            }
        }
        recomputeProgress(agg);
        run.setStatus(RunStatus.CANCELLED);
        finish(run, now);
        events.add(runEvent(agg, RunEventType.RUN_CANCELLED,
                reason == null || reason.isBlank() ? "Run cancelled" : "Run cancelled: " + reason));
        return events;
    }

    /**
     * Fails a run whose deadline has passed. Tasks that have not started are
     * skipped; RUNNING tasks are discarded when they report.
     *
     * @return no events when the run is terminal or its deadline is still ahead
     */
    public List<RunEvent> timeOut(RunAggregate agg) {
        Run run = agg.run();
        Instant now = clock.instant();
        if (run.getStatus().isTerminal() || run.getTimeoutAt() == null || run.getTimeoutAt().isAfter(now)) {
            return List.of();
        }
        List<RunEvent> events = new ArrayList<>();
        for (TaskExecution t : agg.tasks()) {
            if (t.getStatus() == TaskStatus.PENDING
                    || t.getStatus() == TaskStatus.READY
                    || t.getStatus() == TaskStatus.RETRYING) {
                skip(t, now);
                events.add(taskEvent(agg, t, RunEventType.TASK_SKIPPED,
                        "Task '" + t.getNodeId() + "' skipped: run timed out", null));
            }
        }
        recomputeProgress(agg);
        long limitMs = Duration.between(run.getQueuedAt(), run.getTimeoutAt()).toMillis();
        run.setLastError("Run exceeded its timeout of " + limitMs + " ms");
        run.setStatus(RunStatus.FAILED);
        finish(run, now);
        events.add(runEvent(agg, RunEventType.RUN_FAILED, run.getLastError(), RUN_TIMEOUT));
        log.warn("Run {} timed out after {} ms", run.getId(), limitMs);
        return events;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    private void succeed(RunAggregate agg, TaskExecution task, TaskTransition t, List<RunEvent> events) {
        Run run = agg.run();
        Instant now = clock.instant();
        task.setStatus(TaskStatus.SUCCEEDED);
        task.setOutput(t.outputs() == null ? null : new LinkedHashMap<>(t.outputs()));
        task.recordUsage(t.cost(), t.tokensUsed());
        task.recordError(null, null);
        task.setFinishedAt(now);
        task.setWorkerId(null);
        run.addUsage(t.cost(), t.tokensUsed());

        events.add(taskEvent(agg, task, RunEventType.TASK_COMPLETED,
                "Task '" + task.getNodeId() + "' completed in " + elapsedMs(task, now) + " ms", null));

        // Dependents whose dependencies have all SUCCEEDED become READY.
        for (TaskExecution dependent : agg.tasks()) {
            if (dependent.getStatus() == TaskStatus.PENDING
                    && dependent.getDependsOn().contains(task.getNodeId())
                    && allSucceeded(agg, dependent.getDependsOn())) {
                dependent.setStatus(TaskStatus.READY);
            }
        }
    }

    private void scheduleRetry(RunAggregate agg, TaskExecution task, TaskTransition t, List<RunEvent> events) {
        Run run = agg.run();
        Instant now = clock.instant();
        Instant retryAt = t.retryAt() == null ? now : t.retryAt();
        task.setStatus(TaskStatus.RETRYING);
        task.recordError(t.errorCode(), t.error());
        task.setNextAttemptAt(retryAt);
        task.setWorkerId(null);
        task.setHeartbeatAt(null);
        run.incrementRetryCount();

        events.add(taskEvent(agg, task, RunEventType.TASK_RETRYING,
                "Task '" + task.getNodeId() + "' attempt " + task.getAttempt() + " failed: " + t.error()
                        + "; retrying in " + Duration.between(now, retryAt).toMillis() + " ms",
                t.errorCode()));
    }

    private void fail(RunAggregate agg, TaskExecution task, TaskTransition t, List<RunEvent> events) {
        Run run = agg.run();
        Instant now = clock.instant();
        task.setStatus(TaskStatus.FAILED);
        task.recordError(t.errorCode(), t.error());
        task.setFinishedAt(now);
        task.setWorkerId(null);
        if (!task.isOptional()) {
            run.setLastError("Task '" + task.getNodeId() + "' failed: " + t.error());
        }

        events.add(taskEvent(agg, task, RunEventType.TASK_FAILED,
                "Task '" + task.getNodeId() + "' failed after " + task.getAttempt()
                        + " attempt(s): " + t.error(), t.errorCode()));

        for (TaskExecution dependent : transitiveDependents(agg, task.getNodeId())) {
            if (dependent.getStatus() == TaskStatus.PENDING || dependent.getStatus() == TaskStatus.READY) {
                skip(dependent, now);
                events.add(taskEvent(agg, dependent, RunEventType.TASK_SKIPPED,
                        "Task '" + dependent.getNodeId() + "' skipped: upstream task '"
                                + task.getNodeId() + "' failed", null));
            }
        }
    }

    // Run is terminal or cancel-requested: drop the result, leave the run untouched.
    private List<RunEvent> discard(RunAggregate agg, TaskExecution task) {
        skip(task, clock.instant());
        String why = agg.run().isCancelRequested() ? "cancelled" : agg.run().getStatus().name().toLowerCase();
        return List.of(taskEvent(agg, task, RunEventType.TASK_SKIPPED,
                "Task '" + task.getNodeId() + "' result discarded: run " + why, null));
    }

    private void finalizeIfResolved(RunAggregate agg, List<RunEvent> events) {
        Run run = agg.run();
        if (run.getStatus().isTerminal()) {
            return;
        }
        boolean unresolved = agg.tasks().stream().anyMatch(t -> UNRESOLVED.contains(t.getStatus()));
        if (unresolved) {
            return;
        }

        // Only optional tasks may end without succeeding; a skipped critical task never ran its work.
        List<String> criticalFailures = agg.tasks().stream()
                .filter(t -> t.getStatus() == TaskStatus.FAILED && !t.isOptional())
                .map(TaskExecution::getNodeId)
                .toList();
        List<String> criticalSkips = agg.tasks().stream()
                .filter(t -> t.getStatus() == TaskStatus.SKIPPED && !t.isOptional())
                .map(TaskExecution::getNodeId)
                .toList();

        Instant now = clock.instant();
        if (criticalFailures.isEmpty() && criticalSkips.isEmpty()) {
            run.setStatus(RunStatus.COMPLETED);
            run.setPipelineOutputs(collectOutputs(agg));
            finish(run, now);
            events.add(runEvent(agg, RunEventType.RUN_COMPLETED,
                    "Run completed in " + run.getDurationMs() + " ms, cost " + run.getTotalCost()
                            + ", " + run.getTokensUsed() + " tokens"));
        } else {
            if (criticalFailures.isEmpty()) {
                run.setLastError("Critical task(s) " + criticalSkips + " skipped after an optional task failed");
            }
            run.setStatus(RunStatus.FAILED);
            finish(run, now);
            events.add(runEvent(agg, RunEventType.RUN_FAILED, criticalFailures.isEmpty()
                    ? "Run failed: critical task(s) " + criticalSkips + " were skipped"
                    : "Run failed: critical task(s) " + criticalFailures + " failed"));
        }
        log.info("Run {} finished as {} ({} tasks, {} retries, {} ms)",
                run.getId(), run.getStatus(), run.getTotalTasks(), run.getRetryCount(), run.getDurationMs());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void recomputeProgress(RunAggregate agg) {
        Run run = agg.run();
        if (run.getStatus().isTerminal()) {
            return;
        }
        int total = agg.tasks().size();
        int completed = (int) agg.tasks().stream().filter(t -> t.getStatus().isResolved()).count();
        run.setTotalTasks(total);
        run.setCompletedTasks(completed);
        run.setProgress(total == 0 ? 1.0 : (double) completed / total);
    }

    private static void finish(Run run, Instant now) {
        run.setCompletedAt(now);
        Instant from = run.getStartedAt() != null ? run.getStartedAt() : run.getQueuedAt();
        run.setDurationMs(from == null ? 0L : Math.max(0L, Duration.between(from, now).toMillis()));
    }

    private static void skip(TaskExecution task, Instant now) {
        task.setStatus(TaskStatus.SKIPPED);
        task.setFinishedAt(now);
        task.setNextAttemptAt(null);
        task.setWorkerId(null);
    }

    private static boolean allSucceeded(RunAggregate agg, List<String> nodeIds) {
        for (String nodeId : nodeIds) {
            TaskExecution dep = agg.taskForNode(nodeId).orElse(null);
            if (dep == null || dep.getStatus() != TaskStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    // Breadth-first over dependsOn edges, in plan order.
    private static List<TaskExecution> transitiveDependents(RunAggregate agg, String nodeId) {
        Set<String> reached = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(nodeId);
        while (!frontier.isEmpty()) {
            String current = frontier.poll();
            for (TaskExecution t : agg.tasks()) {
                if (t.getDependsOn().contains(current) && reached.add(t.getNodeId())) {
                    frontier.add(t.getNodeId());
                }
            }
        }
        return agg.tasks().stream().filter(t -> reached.contains(t.getNodeId())).toList();
    }

    private static long elapsedMs(TaskExecution task, Instant now) {
        return task.getStartedAt() == null ? 0L : Duration.between(task.getStartedAt(), now).toMillis();
    }

    // Outputs of every SUCCEEDED task keyed by node id, in plan order.
    private static Map<String, Object> collectOutputs(RunAggregate agg) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (TaskExecution t : agg.tasks()) {
            if (t.getStatus() == TaskStatus.SUCCEEDED && t.getOutput() != null) {
                outputs.put(t.getNodeId(), new LinkedHashMap<>(t.getOutput()));
            }
        }
        return outputs;
    }

    private RunEvent runEvent(RunAggregate agg, RunEventType type, String message) {
        return runEvent(agg, type, message, null);
    }

    private RunEvent runEvent(RunAggregate agg, RunEventType type, String message, String errorCode) {
        recomputeProgress(agg);
        Run run = agg.run();
        return new RunEvent(run.getId(), run.nextEventSequence(), type, null, null, 0,
                run.getStatus(), null, run.getProgress(), message, errorCode, clock.instant());
    }

    private RunEvent taskEvent(RunAggregate agg, TaskExecution task, RunEventType type,
                               String message, String errorCode) {
        recomputeProgress(agg);
        Run run = agg.run();
        return new RunEvent(run.getId(), run.nextEventSequence(), type, task.getId(), task.getNodeId(),
                task.getAttempt(), run.getStatus(), task.getStatus(), run.getProgress(), message,
                errorCode, clock.instant());
    }
}
