package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.event.RunEvent;
import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.graph.TaskSpec;
import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.repository.ExecutionLogRepository;
import com.imaginarium.orchestrator.repository.RunRepository;
import com.imaginarium.orchestrator.repository.TaskExecutionRepository;
import com.imaginarium.orchestrator.supervisor.RunAggregate;
import com.imaginarium.orchestrator.supervisor.RunSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link ExecutionStore}.
 *
 * Lock order inside every write: the run row first (SELECT ... FOR UPDATE),
 * then its tasks. Claims additionally go through a conditional UPDATE so that
 * exactly one worker wins a READY task.
 *
 * Events raised here are delivered by {@code RunEventRelay} after commit;
 * their log entries are written in the same transaction.
 */
@Transactional
public class JpaExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaExecutionStore.class);

    private static final List<RunStatus> ACTIVE = List.of(RunStatus.QUEUED, RunStatus.RUNNING);

    private final RunRepository             runRepo;
    private final TaskExecutionRepository   taskRepo;
    private final ExecutionLogRepository    logRepo;
    private final RunSupervisor             supervisor;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    public JpaExecutionStore(RunRepository runRepo,
                             TaskExecutionRepository taskRepo,
                             ExecutionLogRepository logRepo,
                             RunSupervisor supervisor,
                             ApplicationEventPublisher events,
                             Clock clock) {
        this.runRepo    = runRepo;
        this.taskRepo   = taskRepo;
        this.logRepo    = logRepo;
        this.supervisor = supervisor;
        this.events     = events;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public Run createRun(ExecutionPlan plan, RunRequest request) {
        Run run = new Run(request.pipelineId(), request.userId(), request.priority());
        run.setQueuedAt(clock.instant());
        run.setQueueSequence(runRepo.nextQueueSequence());
        run.setParentRunId(request.parentRunId());
        if (request.timeout() != null) {
            run.setTimeoutAt(run.getQueuedAt().plus(request.timeout()));
        }

        List<TaskExecution> tasks = new ArrayList<>();
        for (TaskSpec spec : plan.tasks()) {
            tasks.add(TaskFactory.fromSpec(run.getId(), spec, request.maxRetries()));
        }
        RunAggregate agg = new RunAggregate(run, tasks);
        List<RunEvent> produced = supervisor.initialize(agg);
        persist(agg, produced);

        log.info("Created run {} for pipeline '{}' ({} tasks, priority {})",
                run.getId(), run.getPipelineId(), tasks.size(), run.getPriority());
        return run;
    }

    @Override
    public Optional<ClaimedTask> claimTask(UUID taskId, String workerId) {
        Optional<UUID> runId = taskRepo.findRunIdById(taskId);
        if (runId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Run> locked = runRepo.findByIdForUpdate(runId.get());
        if (locked.isEmpty() || !supervisor.acceptsClaims(locked.get())) {
            return Optional.empty();
        }

        int won = taskRepo.compareAndSetRunning(taskId, workerId, clock.instant(),
                TaskStatus.READY, TaskStatus.RUNNING);
        if (won == 0) {
            log.debug("Lost claim on task {} to another worker", taskId);
            return Optional.empty();
        }

        // The CAS cleared the persistence context; the row lock is still ours.
        RunAggregate agg = aggregate(runRepo.findById(runId.get()).orElseThrow());
        TaskExecution task = agg.task(taskId).orElseThrow();
        List<RunEvent> produced = supervisor.onTaskClaimed(agg, task, workerId);
        persist(agg, produced);
        return Optional.of(new ClaimedTask(task.copy(), InputResolver.resolve(task, agg.tasks())));
    }

    @Override
    public boolean heartbeat(UUID taskId, int attempt) {
        return taskRepo.heartbeat(taskId, attempt, clock.instant(), TaskStatus.RUNNING) > 0;
    }

    @Override
    public boolean updateTaskStatus(UUID taskId, TaskTransition transition) {
        Optional<UUID> runId = taskRepo.findRunIdById(taskId);
        if (runId.isEmpty()) {
            log.warn("Ignoring {} for unknown task {}", transition.kind(), taskId);
            return false;
        }
        RunAggregate agg = aggregate(lockRun(runId.get()));
        List<RunEvent> produced = supervisor.apply(agg, taskId, transition);
        if (produced.isEmpty()) {
            return false;
        }
        persist(agg, produced);
        return true;
    }

    @Override
    public boolean cancelRun(UUID runId, String reason) {
        RunAggregate agg = aggregate(lockRun(runId));
        List<RunEvent> produced = supervisor.cancel(agg, reason);
        if (produced.isEmpty()) {
            return false;
        }
        persist(agg, produced);
        return true;
    }

    @Override
    public boolean timeOutRun(UUID runId) {
        RunAggregate agg = aggregate(lockRun(runId));
        List<RunEvent> produced = supervisor.timeOut(agg);
        if (produced.isEmpty()) {
            return false;
        }
        persist(agg, produced);
        return true;
    }

    @Override
    public ExecutionLogEntry appendLog(ExecutionLogEntry entry) {
        return logRepo.save(entry);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public Optional<Run> loadRun(UUID runId) {
        return runRepo.findById(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskExecution> listTasks(UUID runId) {
        return taskRepo.findByRunIdOrderByExecutionOrderAsc(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TaskExecution> loadTask(UUID taskId) {
        return taskRepo.findById(taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Run> listEligibleRuns(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return runRepo.findEligible(ACTIVE, TaskStatus.READY, TaskStatus.RETRYING,
                clock.instant(), PageRequest.of(0, limit));
    }

    @Override
    public List<TaskExecution> findReadyTasks(UUID runId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Optional<Run> run = runRepo.findByIdForUpdate(runId);
        if (run.isEmpty()) {
            return List.of();
        }
        RunAggregate agg = aggregate(run.get());
        if (supervisor.promoteDueRetries(agg) > 0) {
            taskRepo.saveAll(agg.tasks());
        }
        return agg.tasks().stream()
                .filter(t -> t.getStatus() == TaskStatus.READY)
                .limit(limit)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionLogEntry> listLogs(UUID runId, long afterSequence, int limit) {
        return logRepo.findByRunIdAndIdGreaterThanOrderByIdAsc(runId, afterSequence, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskExecution> findStalledTasks(Instant cutoff) {
        return taskRepo.findByStatusAndHeartbeatAtBefore(TaskStatus.RUNNING, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Run> findTimedOutRuns(Instant now) {
        return runRepo.findByStatusInAndTimeoutAtLessThanEqual(ACTIVE, now);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Run lockRun(UUID runId) {
        return runRepo.findByIdForUpdate(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private RunAggregate aggregate(Run run) {
        return new RunAggregate(run, taskRepo.findByRunIdOrderByExecutionOrderAsc(run.getId()));
    }

    private void persist(RunAggregate agg, List<RunEvent> produced) {
        runRepo.save(agg.run());
        taskRepo.saveAll(agg.tasks());
        for (RunEvent event : produced) {
            logRepo.save(event.toLogEntry());
            events.publishEvent(event);
        }
    }
}
