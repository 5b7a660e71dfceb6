package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.config.OrchestratorProperties;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.node.ErrorClassification;
import com.imaginarium.orchestrator.store.ClaimConflictException;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background loops that drive execution.
 *
 * Dispatch: every {@code dispatch-interval-ms}, fill the free worker slots
 * with READY tasks, taking runs in (priority desc, queuedAt asc) order and
 * draining each run before moving to the next. Any task that can start
 * starts as soon as a slot is free, and a run's position only improves as
 * runs ahead of it finish.
 *
 * Recovery: every {@code recovery-interval-ms}, runs past their deadline are
 * failed, and RUNNING tasks whose worker stopped heartbeating are treated as
 * transient failures so they are retried.
 *
 * The store is the queue; there is no in-process queue to lose on restart.
 */
@Component
@EnableScheduling
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutionStore         store;
    private final TaskExecutorPool       pool;
    private final TaskOutcomeRecorder    recorder;
    private final StoreRetryTemplate     retryTemplate;
    private final StoreHealthIndicator   storeHealth;
    private final OrchestratorProperties props;
    private final Clock                  clock;

    public Dispatcher(ExecutionStore store,
                      TaskExecutorPool pool,
                      TaskOutcomeRecorder recorder,
                      StoreRetryTemplate retryTemplate,
                      StoreHealthIndicator storeHealth,
                      OrchestratorProperties props,
                      Clock clock) {
        this.store         = store;
        this.pool          = pool;
        this.recorder      = recorder;
        this.retryTemplate = retryTemplate;
        this.storeHealth   = storeHealth;
        this.props         = props;
        this.clock         = clock;
    }

    @Scheduled(fixedDelayString = "${orchestrator.dispatch-interval-ms:500}")
    public void tick() {
        try {
            dispatchOnce();
        } catch (ClaimConflictException e) {
            log.debug("Dispatch cycle gave up on a contended run: {}", e.getMessage());
        }
    }

    /**
     * One admission cycle.
     *
     * @return number of tasks handed to the pool
     */
    public int dispatchOnce() {
        int capacity = pool.freeCapacity();
        if (capacity == 0) {
            return 0;
        }

        List<Run> eligible;
        try {
            eligible = retryTemplate.execute("list eligible runs",
                    () -> store.listEligibleRuns(props.getEligibleRunScanLimit()));
        } catch (StoreUnavailableException e) {
            if (storeHealth.isUp()) {
                log.error("Execution store unavailable, suspending admissions: {}", e.getMessage());
            }
            storeHealth.markDegraded(e);
            return 0;
        }
        if (!storeHealth.isUp()) {
            log.info("Execution store reachable again, resuming admissions");
        }
        storeHealth.markUp();

        int admitted = 0;
        for (Run run : eligible) {
            int remaining = capacity - admitted;
            if (remaining <= 0) {
                break;
            }
            List<TaskExecution> ready;
            try {
                ready = retryTemplate.execute("find ready tasks of run " + run.getId(),
                        () -> store.findReadyTasks(run.getId(), remaining));
            } catch (StoreUnavailableException e) {
                storeHealth.markDegraded(e);
                log.warn("Store unavailable mid-cycle after admitting {} task(s)", admitted);
                return admitted;
            }
            for (TaskExecution task : ready) {
                if (admitted >= capacity) {
                    break;
                }
                if (pool.submit(task.getId())) {
                    admitted++;
                    log.debug("Admitted task '{}' of run {} (priority {})",
                            task.getNodeId(), run.getId(), run.getPriority());
                }
            }
        }
        return admitted;
    }

    @Scheduled(fixedDelayString = "${orchestrator.recovery-interval-ms:60000}",
               initialDelayString = "${orchestrator.recovery-interval-ms:60000}")
    public void recoveryTick() {
        try {
            failTimedOutRuns();
            recoverStalledTasks();
        } catch (StoreUnavailableException | ClaimConflictException e) {
            log.warn("Recovery cycle skipped: {}", e.getMessage());
        }
    }

    /** @return number of runs failed for exceeding their deadline */
    public int failTimedOutRuns() {
        Instant now = clock.instant();
        List<Run> overdue = retryTemplate.execute("find timed-out runs", () -> store.findTimedOutRuns(now));

        int failed = 0;
        for (Run run : overdue) {
            if (retryTemplate.execute("time out run " + run.getId(), () -> store.timeOutRun(run.getId()))) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * Retry RUNNING tasks whose heartbeat is older than {@code stall-timeout}
     * (worker crashed or the process restarted mid-task).
     *
     * @return number of tasks recovered
     */
    public int recoverStalledTasks() {
        Instant cutoff = clock.instant().minus(props.getStallTimeout());
        List<TaskExecution> stalled = retryTemplate.execute("find stalled tasks",
                () -> store.findStalledTasks(cutoff));

        int recovered = 0;
        for (TaskExecution task : stalled) {
            if (pool.isInFlight(task.getId())) {
                continue;   // ours and still being waited on
            }
            log.warn("Task {} ({}) of run {} stalled: last heartbeat {}, worker {}",
                    task.getId(), task.getNodeId(), task.getRunId(), task.getHeartbeatAt(), task.getWorkerId());
            if (recorder.failed(task, ErrorClassification.TRANSIENT, "STALLED",
                    "Worker " + task.getWorkerId() + " stopped heartbeating")) {
                recovered++;
            }
        }
        return recovered;
    }
}
