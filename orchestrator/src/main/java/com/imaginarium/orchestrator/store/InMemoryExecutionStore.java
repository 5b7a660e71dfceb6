package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.event.RunEvent;
import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.graph.TaskSpec;
import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.supervisor.RunAggregate;
import com.imaginarium.orchestrator.supervisor.RunSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-local {@link ExecutionStore} for development and tests.
 *
 * Each run is guarded by its own {@link ReentrantLock}; readers get detached
 * copies, so nothing outside the lock ever sees a half-applied transition.
 * Events are recorded and published while the lock is held, so listeners
 * receive each run's events in sequence order.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionStore.class);

    private static final Duration LOCK_TIMEOUT = Duration.ofSeconds(5);

    private static final Comparator<Run> DISPATCH_ORDER = Comparator
            .comparingInt(Run::getPriority).reversed()
            .thenComparing(Run::getQueuedAt)
            .thenComparingLong(Run::getQueueSequence);

    private final Map<UUID, RunState> runs      = new ConcurrentHashMap<>();
    private final Map<UUID, UUID>     taskIndex = new ConcurrentHashMap<>();   // taskId → runId
    private final AtomicLong queueSequence = new AtomicLong();
    private final AtomicLong logSequence   = new AtomicLong();

    private final RunSupervisor             supervisor;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    public InMemoryExecutionStore(RunSupervisor supervisor, ApplicationEventPublisher events, Clock clock) {
        this.supervisor = supervisor;
        this.events     = events;
        this.clock      = clock;
    }

    private static final class RunState {
        final ReentrantLock           lock  = new ReentrantLock();
        final Run                     run;
        final List<TaskExecution>     tasks;
        final List<ExecutionLogEntry> logs  = new ArrayList<>();

        RunState(Run run, List<TaskExecution> tasks) {
            this.run   = run;
            this.tasks = tasks;
        }

        RunAggregate aggregate() {
            return new RunAggregate(run, tasks);
        }
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public Run createRun(ExecutionPlan plan, RunRequest request) {
        Run run = new Run(request.pipelineId(), request.userId(), request.priority());
        run.setQueuedAt(clock.instant());
        run.setQueueSequence(queueSequence.incrementAndGet());
        run.setParentRunId(request.parentRunId());
        if (request.timeout() != null) {
            run.setTimeoutAt(run.getQueuedAt().plus(request.timeout()));
        }

        List<TaskExecution> tasks = new ArrayList<>();
        for (TaskSpec spec : plan.tasks()) {
            tasks.add(TaskFactory.fromSpec(run.getId(), spec, request.maxRetries()));
        }
        RunState state = new RunState(run, tasks);

        List<RunEvent> produced;
        state.lock.lock();
        try {
            produced = supervisor.initialize(state.aggregate());
            runs.put(run.getId(), state);
            tasks.forEach(t -> taskIndex.put(t.getId(), run.getId()));
            commit(state, produced);
        } finally {
            state.lock.unlock();
        }
        log.info("Created run {} for pipeline '{}' ({} tasks, priority {})",
                run.getId(), run.getPipelineId(), tasks.size(), run.getPriority());
        return run.copy();
    }

    @Override
    public Optional<ClaimedTask> claimTask(UUID taskId, String workerId) {
        RunState state = stateForTask(taskId);
        if (state == null) {
            return Optional.empty();
        }
        List<RunEvent> produced = new ArrayList<>();
        Optional<ClaimedTask> claimed = locked(state, s -> {
            if (!supervisor.acceptsClaims(s.run)) {
                return Optional.empty();
            }
            TaskExecution task = find(s, taskId);
            // Check-and-set: only a READY task can be claimed.
            if (task == null || task.getStatus() != TaskStatus.READY) {
                return Optional.empty();
            }
            task.setStatus(TaskStatus.RUNNING);
            produced.addAll(supervisor.onTaskClaimed(s.aggregate(), task, workerId));
            commit(s, produced);
            return Optional.of(new ClaimedTask(task.copy(), InputResolver.resolve(task, s.tasks)));
        });
        return claimed;
    }

    @Override
    public boolean heartbeat(UUID taskId, int attempt) {
        RunState state = stateForTask(taskId);
        if (state == null) {
            return false;
        }
        return locked(state, s -> {
            TaskExecution task = find(s, taskId);
            if (task == null || task.getStatus() != TaskStatus.RUNNING || task.getAttempt() != attempt) {
                return false;
            }
            task.setHeartbeatAt(clock.instant());
            return true;
        });
    }

    @Override
    public boolean updateTaskStatus(UUID taskId, TaskTransition transition) {
        RunState state = stateForTask(taskId);
        if (state == null) {
            return false;
        }
        List<RunEvent> produced = new ArrayList<>();
        locked(state, s -> {
            produced.addAll(supervisor.apply(s.aggregate(), taskId, transition));
            commit(s, produced);
            return null;
        });
        return !produced.isEmpty();
    }

    @Override
    public boolean cancelRun(UUID runId, String reason) {
        RunState state = runs.get(runId);
        if (state == null) {
            throw new RunNotFoundException(runId);
        }
        List<RunEvent> produced = new ArrayList<>();
        locked(state, s -> {
            produced.addAll(supervisor.cancel(s.aggregate(), reason));
            commit(s, produced);
            return null;
        });
        return !produced.isEmpty();
    }

    @Override
    public boolean timeOutRun(UUID runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            throw new RunNotFoundException(runId);
        }
        List<RunEvent> produced = new ArrayList<>();
        locked(state, s -> {
            produced.addAll(supervisor.timeOut(s.aggregate()));
            commit(s, produced);
            return null;
        });
        return !produced.isEmpty();
    }

    @Override
    public ExecutionLogEntry appendLog(ExecutionLogEntry entry) {
        RunState state = runs.get(entry.getRunId());
        if (state == null) {
            throw new RunNotFoundException(entry.getRunId());
        }
        return locked(state, s -> {
            entry.assignSequence(logSequence.incrementAndGet());
            s.logs.add(entry);
            return entry;
        });
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<Run> loadRun(UUID runId) {
        RunState state = runs.get(runId);
        return state == null ? Optional.empty() : Optional.of(locked(state, s -> s.run.copy()));
    }

    @Override
    public List<TaskExecution> listTasks(UUID runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            return List.of();
        }
        return locked(state, s -> s.tasks.stream().map(TaskExecution::copy).toList());
    }

    @Override
    public Optional<TaskExecution> loadTask(UUID taskId) {
        RunState state = stateForTask(taskId);
        if (state == null) {
            return Optional.empty();
        }
        return locked(state, s -> Optional.ofNullable(find(s, taskId)).map(TaskExecution::copy));
    }

    @Override
    public List<Run> listEligibleRuns(int limit) {
        Instant now = clock.instant();
        List<Run> eligible = new ArrayList<>();
        for (RunState state : runs.values()) {
            Run snapshot = locked(state, s -> {
                if (!supervisor.acceptsClaims(s.run)) {
                    return null;
                }
                boolean hasWork = s.tasks.stream().anyMatch(t ->
                        t.getStatus() == TaskStatus.READY
                                || (t.getStatus() == TaskStatus.RETRYING
                                    && (t.getNextAttemptAt() == null || !t.getNextAttemptAt().isAfter(now))));
                return hasWork ? s.run.copy() : null;
            });
            if (snapshot != null) {
                eligible.add(snapshot);
            }
        }
        return eligible.stream().sorted(DISPATCH_ORDER).limit(limit).toList();
    }

    @Override
    public List<TaskExecution> findReadyTasks(UUID runId, int limit) {
        RunState state = runs.get(runId);
        if (state == null || limit <= 0) {
            return List.of();
        }
        return locked(state, s -> {
            supervisor.promoteDueRetries(s.aggregate());
            return s.tasks.stream()
                    .filter(t -> t.getStatus() == TaskStatus.READY)
                    .limit(limit)
                    .map(TaskExecution::copy)
                    .toList();
        });
    }

    @Override
    public List<ExecutionLogEntry> listLogs(UUID runId, long afterSequence, int limit) {
        RunState state = runs.get(runId);
        if (state == null) {
            return List.of();
        }
        return locked(state, s -> s.logs.stream()
                .filter(e -> e.getSequence() > afterSequence)
                .limit(limit)
                .toList());
    }

    @Override
    public List<TaskExecution> findStalledTasks(Instant cutoff) {
        List<TaskExecution> stalled = new ArrayList<>();
        for (RunState state : runs.values()) {
            stalled.addAll(locked(state, s -> s.tasks.stream()
                    .filter(t -> t.getStatus() == TaskStatus.RUNNING
                            && t.getHeartbeatAt() != null
                            && t.getHeartbeatAt().isBefore(cutoff))
                    .map(TaskExecution::copy)
                    .toList()));
        }
        return stalled;
    }

    @Override
    public List<Run> findTimedOutRuns(Instant now) {
        List<Run> timedOut = new ArrayList<>();
        for (RunState state : runs.values()) {
            Run snapshot = locked(state, s -> !s.run.getStatus().isTerminal()
                    && s.run.getTimeoutAt() != null
                    && !s.run.getTimeoutAt().isAfter(now) ? s.run.copy() : null);
            if (snapshot != null) {
                timedOut.add(snapshot);
            }
        }
        return timedOut;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RunState stateForTask(UUID taskId) {
        UUID runId = taskIndex.get(taskId);
        return runId == null ? null : runs.get(runId);
    }

    private static TaskExecution find(RunState s, UUID taskId) {
        for (TaskExecution t : s.tasks) {
            if (t.getId().equals(taskId)) return t;
        }
        return null;
    }

    private <T> T locked(RunState state, Function<RunState, T> action) {
        boolean acquired;
        try {
            acquired = state.lock.tryLock(LOCK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaimConflictException("Interrupted waiting for lock on run " + state.run.getId(), e);
        }
        if (!acquired) {
            throw new ClaimConflictException("Timed out waiting for lock on run " + state.run.getId());
        }
        try {
            return action.apply(state);
        } finally {
            state.lock.unlock();
        }
    }

    // Caller holds the run lock.
    private void commit(RunState state, List<RunEvent> produced) {
        for (RunEvent event : produced) {
            ExecutionLogEntry entry = event.toLogEntry();
            entry.assignSequence(logSequence.incrementAndGet());
            state.logs.add(entry);
        }
        produced.forEach(events::publishEvent);
    }
}
